package com.trendloop.orchestrator.stage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {

    RunContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new RunContext(UUID.randomUUID());
    }

    @Test
    void laterStage_cannotReplaceUpstreamKey() {
        ctx.enterStage("trend-analysis");
        ctx.put("selected_keyword", "linen blazer");
        ctx.leaveStage();

        ctx.enterStage("writing");
        assertThatThrownBy(() -> ctx.put("selected_keyword", "something else"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("trend-analysis");
        assertThat(ctx.get("selected_keyword")).contains("linen blazer");
    }

    @Test
    void stage_mayOverwriteItsOwnKey() {
        ctx.enterStage("writing");
        ctx.put("article_path", "docs/draft.html");
        ctx.put("article_path", "docs/linen-blazer.html");

        assertThat(ctx.require("article_path", String.class)).isEqualTo("docs/linen-blazer.html");
        assertThat(ctx.writerOf("article_path")).contains("writing");
    }

    @Test
    void require_missingOrWrongType_throws() {
        ctx.enterStage("writing");
        ctx.put("article_path", Path.of("docs/a.html"));

        assertThatThrownBy(() -> ctx.require("image_path", String.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing");
        assertThatThrownBy(() -> ctx.require("article_path", String.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected String");
    }

    @Test
    void snapshot_isReadOnlyCopyInInsertionOrder() {
        ctx.enterStage("s");
        ctx.put("b", 2);
        ctx.put("a", 1);

        var copy = ctx.snapshot();
        ctx.put("c", 3);

        assertThat(copy.keySet()).containsExactly("b", "a");
        assertThatThrownBy(() -> copy.put("x", 0)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(ctx.keys()).containsExactly("b", "a", "c");
    }

    @Test
    void blankKey_rejected() {
        assertThatThrownBy(() -> ctx.put(" ", "v")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void putAll_rejectedBatch_writesNothing() {
        ctx.enterStage("trend-analysis");
        ctx.put("selected_keyword", "linen blazer");
        ctx.leaveStage();

        ctx.enterStage("writing");
        Map<String, Object> batch = new LinkedHashMap<>();
        batch.put("article_path", "posts/linen-blazer.md");
        batch.put("selected_keyword", "something else");

        assertThatThrownBy(() -> ctx.putAll(batch))
                .isInstanceOf(IllegalStateException.class);
        assertThat(ctx.contains("article_path")).isFalse();
        assertThat(ctx.get("selected_keyword")).contains("linen blazer");
    }

    @Test
    void putAll_acceptedBatch_attributesEveryKey() {
        ctx.enterStage("image-generation");
        ctx.putAll(Map.of("image_path", "img/a.png", "image_alt", "a linen blazer"));

        assertThat(ctx.writerOf("image_path")).contains("image-generation");
        assertThat(ctx.writerOf("image_alt")).contains("image-generation");
    }
}
