package guraa.uicompare.structural;

import guraa.uicompare.model.LayoutNode;
import guraa.uicompare.model.ReferenceNode;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TreeSimilarityUtilsTest {

    @Test
    void signaturePreservesChildOrder() {
        LayoutNode tree = LayoutNode.builder()
                .type("Column")
                .child(LayoutNode.builder().type("Text").build())
                .child(LayoutNode.builder()
                        .type("Row")
                        .child(LayoutNode.builder().type("Button").build())
                        .build())
                .build();

        assertThat(TreeSimilarityUtils.signature(tree)).isEqualTo("Column(Text(),Row(Button()))");
        assertThat(TreeSimilarityUtils.nodeTypes(tree)).containsExactly("Column", "Text", "Row", "Button");
    }

    @Test
    void signatureIgnoresIdsAndProperties() {
        LayoutNode rendered = LayoutNode.builder().id("a").type("Text").property("text", "Hello").build();
        ReferenceNode reference = ReferenceNode.builder().id("b").type("Text").property("fill", "#000").build();

        assertThat(TreeSimilarityUtils.treeStructureSimilarity(rendered, reference)).isEqualTo(1.0);
    }

    @Test
    void levenshteinDistance() {
        assertThat(TreeSimilarityUtils.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(TreeSimilarityUtils.levenshteinDistance("", "abc")).isEqualTo(3);
        assertThat(TreeSimilarityUtils.levenshteinDistance("abc", "abc")).isZero();
    }

    @Test
    void levenshteinSimilarityOfEmptyStringsIsOne() {
        assertThat(TreeSimilarityUtils.levenshteinSimilarity("", "")).isEqualTo(1.0);
        assertThat(TreeSimilarityUtils.levenshteinSimilarity("abcd", "abXd")).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void jaccard() {
        assertThat(TreeSimilarityUtils.jaccard(Set.of(), Set.of())).isEqualTo(1.0);
        assertThat(TreeSimilarityUtils.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(TreeSimilarityUtils.jaccard(Set.of("a"), Set.of("b"))).isZero();
    }

    @Test
    void nodeTypeSimilarityTreatsDuplicatesAsOne() {
        LayoutNode rendered = LayoutNode.builder()
                .type("Column")
                .child(LayoutNode.builder().type("Text").build())
                .child(LayoutNode.builder().type("Text").build())
                .build();
        ReferenceNode reference = ReferenceNode.builder()
                .type("Column")
                .child(ReferenceNode.builder().type("Text").build())
                .build();

        assertThat(TreeSimilarityUtils.nodeTypeSimilarity(rendered, reference)).isEqualTo(1.0);
        assertThat(TreeSimilarityUtils.treeStructureSimilarity(rendered, reference)).isLessThan(1.0);
    }
}
