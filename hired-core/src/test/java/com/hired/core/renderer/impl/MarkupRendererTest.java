package com.hired.core.renderer.impl;

import com.hired.core.ResumeFixtures;
import com.hired.core.context.ContextBuilder;
import com.hired.core.model.ResumeContent;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.template.ThymeleafTemplateEngine;
import com.hired.core.theme.Theme;
import com.hired.core.theme.ThemeRegistry;
import com.hired.core.theme.ThemeResolver;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupRendererTest {

    private final MarkupRenderer renderer = new MarkupRenderer(
        new ContextBuilder(), new ThemeResolver(ThemeRegistry.builtins()), new ThymeleafTemplateEngine());

    @Test
    void render_alice() {
        String html = new String(renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults()), StandardCharsets.UTF_8);

        assertThat(html)
            .contains("Alice")
            .contains("<h2>Experience</h2>")
            .contains("Acme Corp")
            .contains("Shipped the billing service")
            .doesNotContain("Education")
            .contains("id=\"volunteering\"")
            .contains("<p>Red Cross</p>");
    }

    @Test
    void render_emptySectionsHaveNoHeading() {
        Map<String, Object> raw = new LinkedHashMap<>(ResumeFixtures.aliceRaw());
        raw.put("projects", List.of(Map.of("name", "  "), Map.of()));
        raw.put("skills", List.of());

        for (String theme : ThemeRegistry.BUILTIN_THEMES) {
            String html = renderer.renderMarkup(ResumeContent.fromMap(raw), RenderingConfig.defaults().withTheme(theme));

            assertThat(html).as(theme).doesNotContain("Education", "Projects", "Skills");
        }
    }

    @Test
    void render_extraSectionsInEncounterOrder() {
        Map<String, Object> raw = new LinkedHashMap<>(ResumeFixtures.aliceRaw());
        raw.put("zeta_notes", "last");
        raw.put("alpha-hobbies", List.of("chess", "climbing"));
        raw.put("mentoring", Map.of("program", "Code Club"));

        String html = renderer.renderMarkup(ResumeContent.fromMap(raw), RenderingConfig.defaults());

        int volunteering = html.indexOf("id=\"volunteering\"");
        int zeta = html.indexOf("id=\"zeta_notes\"");
        int alpha = html.indexOf("id=\"alpha-hobbies\"");
        int mentoring = html.indexOf("id=\"mentoring\"");
        assertThat(volunteering).isPositive();
        assertThat(zeta).isGreaterThan(volunteering);
        assertThat(alpha).isGreaterThan(zeta);
        assertThat(mentoring).isGreaterThan(alpha);
        assertThat(html)
            .contains("Zeta Notes", "Alpha Hobbies")
            .contains("<ul><li>chess</li><li>climbing</li></ul>")
            .contains("<dl><dt>program</dt><dd>Code Club</dd></dl>");
    }

    @Test
    void render_escapesContent() {
        Map<String, Object> raw = new LinkedHashMap<>(ResumeFixtures.aliceRaw());
        raw.put("basics", Map.of("name", "<script>alert(1)</script>"));
        raw.put("notes", "Tom & Jerry <3");

        String html = renderer.renderMarkup(ResumeContent.fromMap(raw), RenderingConfig.defaults());

        assertThat(html)
            .doesNotContain("<script>")
            .contains("&lt;script&gt;")
            .contains("Tom &amp; Jerry &lt;3");
    }

    @Test
    void render_customTemplateTakesPrecedence() {
        RenderingConfig config = RenderingConfig.defaults()
            .withTheme("classic")
            .withCustomTemplate("<main><h1 th:text=\"${basics.name}\">n</h1><style th:utext=\"${css}\"></style></main>");

        String html = renderer.renderMarkup(ResumeFixtures.alice(), config);

        assertThat(html).isEqualTo("<main><h1>Alice</h1><style></style></main>");
    }

    @Test
    void render_customCssReplacesThemeStylesheet() {
        String themeCss = ThemeRegistry.builtins().find("default").map(Theme::css).orElseThrow();

        String html = renderer.renderMarkup(ResumeFixtures.alice(),
            RenderingConfig.defaults().withCustomCss("body { color: teal; }"));

        assertThat(html).contains("body { color: teal; }");
        assertThat(themeCss).isNotBlank();
        assertThat(html).doesNotContain(themeCss.strip());
    }

    @Test
    void render_usesThemeStylesheetByDefault() {
        String themeCss = ThemeRegistry.builtins().find("minimal").map(Theme::css).orElseThrow();

        String html = renderer.renderMarkup(ResumeFixtures.alice(), RenderingConfig.defaults().withTheme("minimal"));

        assertThat(html).contains(themeCss.strip());
    }

    @Test
    void render_keepsFalsyLookingValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("basics", Map.of("name", "Alice", "label", "No"));
        raw.put("education", List.of(Map.of("institution", "TU Berlin", "score", 0)));

        String html = renderer.renderMarkup(ResumeContent.fromMap(raw), RenderingConfig.defaults());

        assertThat(html)
            .contains("<p class=\"label\">No</p>")
            .contains("Score: 0");
        for (String theme : ThemeRegistry.BUILTIN_THEMES) {
            Map<String, Object> off = Map.of("basics", Map.of("name", "Alice", "summary", "off"));
            assertThat(renderer.renderMarkup(ResumeContent.fromMap(off), RenderingConfig.defaults().withTheme(theme)))
                .as(theme)
                .contains(">off<");
        }
    }

    @Test
    void render_customCssInjectedWhenTemplateIgnoresIt() {
        RenderingConfig config = RenderingConfig.defaults()
            .withCustomTemplate("<html><head><title>cv</title></head><body><h1 th:text=\"${basics.name}\">n</h1></body></html>")
            .withCustomCss("h1 { color: red; }");

        String html = renderer.renderMarkup(ResumeFixtures.alice(), config);

        assertThat(html).isEqualTo(
            "<html><head><title>cv</title><style>h1 { color: red; }</style></head><body><h1>Alice</h1></body></html>");
    }

    @Test
    void ensureStylesheet_withoutHead_addsOne() {
        assertThat(MarkupRenderer.ensureStylesheet("<html><body>x</body></html>", "p {}"))
            .isEqualTo("<html><head><style>p {}</style></head><body>x</body></html>");
        assertThat(MarkupRenderer.ensureStylesheet("<div>x</div>", "p {}"))
            .isEqualTo("<style>p {}</style><div>x</div>");
        assertThat(MarkupRenderer.ensureStylesheet("<style>p {}</style><div>x</div>", "p {}\n"))
            .isEqualTo("<style>p {}</style><div>x</div>");
    }

    @Test
    void render_unknownThemeFallsBackToDefault() {
        String fallback = renderer.renderMarkup(ResumeFixtures.alice(), RenderingConfig.defaults().withTheme("neon"));
        String expected = renderer.renderMarkup(ResumeFixtures.alice(), RenderingConfig.defaults());

        assertThat(fallback).isEqualTo(expected);
    }

    @Test
    void getId() {
        assertThat(renderer.getId()).isEqualTo("html");
    }
}
