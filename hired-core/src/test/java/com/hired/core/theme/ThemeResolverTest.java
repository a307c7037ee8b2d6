package com.hired.core.theme;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThemeResolver}.
 */
class ThemeResolverTest {

    private final ThemeResolver resolver = new ThemeResolver(ThemeRegistry.of(
        new Theme("default", "<p>default</p>", "p {}"),
        new Theme("minimal", "<p>minimal</p>", "")));

    @Test
    void resolve_knownTheme() {
        assertThat(resolver.resolve("minimal", null)).isEqualTo("<p>minimal</p>");
    }

    @Test
    void resolve_customTemplateIsReturnedVerbatim() {
        String custom = "<div th:text=\"${basics.name}\">x</div>";

        assertThat(resolver.resolve("minimal", custom)).isSameAs(custom);
        assertThat(resolver.resolve("no-such-theme", custom)).isSameAs(custom);
    }

    @Test
    void resolve_blankCustomTemplateFallsThroughToTheme() {
        assertThat(resolver.resolve("minimal", "  ")).isEqualTo("<p>minimal</p>");
    }

    @Test
    void resolve_unknownThemeFallsBackToDefault() {
        assertThat(resolver.resolve("neon", null)).isEqualTo("<p>default</p>");
        assertThat(resolver.resolve(null, null)).isEqualTo("<p>default</p>");
        assertThat(resolver.resolveTheme("neon").name()).isEqualTo("default");
    }

    @Test
    void constructor_requiresDefaultTheme() {
        ThemeRegistry withoutDefault = ThemeRegistry.of(new Theme("minimal", "<p/>", ""));

        assertThatThrownBy(() -> new ThemeResolver(withoutDefault))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("default");
    }
}
