package com.certchaperone.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.certchaperone.backend.modules.admin.presentation.dto.Pagination;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.junit.jupiter.api.Test;

class PageWindowTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void missingValuesUseDefaults() {
        PageWindow window = PageWindow.resolve(null, null, 50, 100);

        assertThat(window.page()).isEqualTo(1);
        assertThat(window.pageSize()).isEqualTo(50);
        assertThat(window.offset()).isZero();
    }

    @Test
    void clampsPageSizeIntoBounds() {
        assertThat(resolve(NODES.numberNode(1), NODES.numberNode(500)).pageSize()).isEqualTo(100);
        assertThat(resolve(NODES.numberNode(1), NODES.numberNode(-3)).pageSize()).isEqualTo(1);
    }

    @Test
    void clampsPageBelowOne() {
        assertThat(resolve(NODES.numberNode(-7), null).page()).isEqualTo(1);
    }

    @Test
    void zeroAndNonNumericValuesFallBackToDefaults() {
        PageWindow window = resolve(NODES.textNode("abc"), NODES.numberNode(0));

        assertThat(window.page()).isEqualTo(1);
        assertThat(window.pageSize()).isEqualTo(50);
        assertThat(resolve(NODES.booleanNode(true), NODES.objectNode()).pageSize()).isEqualTo(50);
    }

    @Test
    void numericStringsAreAccepted() {
        PageWindow window = resolve(NODES.textNode("3"), NODES.textNode(" 20 "));

        assertThat(window.page()).isEqualTo(3);
        assertThat(window.pageSize()).isEqualTo(20);
        assertThat(window.offset()).isEqualTo(40);
        assertThat(window.toPageRequest().getOffset()).isEqualTo(40);
    }

    @Test
    void totalPagesRoundsUp() {
        PageWindow window = resolve(NODES.numberNode(2), NODES.numberNode(1));

        assertThat(window.paginationFor(3)).isEqualTo(new Pagination(2, 1, 3, 3));
        assertThat(resolve(null, NODES.numberNode(50)).paginationFor(101).totalPages()).isEqualTo(3);
        assertThat(resolve(null, NODES.numberNode(50)).paginationFor(100).totalPages()).isEqualTo(2);
        assertThat(resolve(null, NODES.numberNode(50)).paginationFor(50).totalPages()).isEqualTo(1);
        assertThat(resolve(null, null).paginationFor(0).totalPages()).isZero();
    }

    private static PageWindow resolve(JsonNode page, JsonNode pageSize) {
        return PageWindow.resolve(page, pageSize, 50, 100);
    }
}
