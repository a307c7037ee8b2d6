package com.hired.core.renderer;

import com.hired.core.model.ResumeContent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RendererRegistry}.
 */
class RendererRegistryTest {

    private final RendererRegistry registry = new RendererRegistry();

    @Test
    void get_unknownFormatListsRegisteredFormats() {
        registry.register("html", () -> new FixedRenderer("html"));
        registry.register("pdf", () -> new FixedRenderer("pdf"));

        assertThatThrownBy(() -> registry.get("unknown-format"))
            .isInstanceOf(UnknownFormatException.class)
            .hasMessageContaining("unknown-format")
            .hasMessageContaining("[html, pdf]")
            .satisfies(e -> assertThat(((UnknownFormatException) e).getAvailableFormats()).containsExactly("html", "pdf"));
    }

    @Test
    void get_neverSubstitutesAnotherFormat() {
        registry.register("html", () -> new FixedRenderer("html"));

        assertThatThrownBy(() -> registry.get("HTML")).isInstanceOf(UnknownFormatException.class);
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(UnknownFormatException.class);
    }

    @Test
    void register_overrideReturnsNewRenderer() {
        registry.register("markup", () -> new FixedRenderer("built-in"));
        Renderer builtIn = registry.get("markup");

        FixedRenderer custom = new FixedRenderer("custom");
        registry.register("markup", () -> custom);

        assertThat(registry.get("markup")).isSameAs(custom).isNotSameAs(builtIn);
        assertThat(registry.list()).containsExactly("markup");
    }

    @Test
    void get_createsInstanceLazilyAndOnce() {
        AtomicInteger created = new AtomicInteger();
        registry.register("txt", () -> {
            created.incrementAndGet();
            return new FixedRenderer("txt");
        });

        assertThat(created).hasValue(0);
        Renderer first = registry.get("txt");
        Renderer second = registry.get("txt");

        assertThat(first).isSameAs(second);
        assertThat(created).hasValue(1);
    }

    @Test
    void get_concurrentFirstLookupsShareOneInstance() throws Exception {
        AtomicInteger created = new AtomicInteger();
        registry.register("slow", () -> {
            created.incrementAndGet();
            sleepQuietly();
            return new FixedRenderer("slow");
        });

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Renderer>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.get("slow");
                }));
            }
            start.countDown();

            Set<Renderer> instances = ConcurrentHashMap.newKeySet();
            for (Future<Renderer> future : futures) {
                instances.add(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(instances).hasSize(1);
            assertThat(created).hasValue(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void get_failingFactoryIsReportedAndRetried() {
        AtomicInteger attempts = new AtomicInteger();
        registry.register("flaky", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("not yet");
            }
            return new FixedRenderer("flaky");
        });

        assertThatThrownBy(() -> registry.get("flaky"))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("flaky")
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(registry.get("flaky").getId()).isEqualTo("flaky");
    }

    @Test
    void get_nullFromFactoryIsRejected() {
        registry.register("null", () -> null);

        assertThatThrownBy(() -> registry.get("null"))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void list_keepsRegistrationOrder() {
        registry.register("pdf", () -> new FixedRenderer("pdf"));
        registry.register("html", () -> new FixedRenderer("html"));
        registry.register("pdf", () -> new FixedRenderer("pdf2"));

        assertThat(registry.list()).containsExactly("pdf", "html");
        assertThat(registry.isRegistered("html")).isTrue();
        assertThat(registry.isRegistered("docx")).isFalse();
    }

    @Test
    void register_rejectsBlankNames() {
        assertThatThrownBy(() -> registry.register(" ", () -> new FixedRenderer("x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(50);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record FixedRenderer(String id) implements Renderer {

        @Override
        public String getId() {
            return id;
        }

        @Override
        public byte[] render(ResumeContent content, RenderingConfig config) {
            return id.getBytes(StandardCharsets.UTF_8);
        }
    }
}
