package com.tx.insights.taxonomy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TDD tests for TaxonomyBuilder.
 */
class TaxonomyBuilderTest {

    private TaxonomyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TaxonomyBuilder();
    }

    @Nested
    class StructureTests {

        @Test
        void shouldCreateEveryPrefixOfAPath() {
            // When
            TaxonomyTree tree = builder.build(List.of("Electronics > Phones > Smartphones"));

            // Then
            assertThat(tree.size()).isEqualTo(3);
            assertThat(tree.get("electronics").isRoot()).isTrue();
            assertThat(tree.get("electronics-phones").getParentId()).isEqualTo("electronics");
            assertThat(tree.get("electronics-phones-smartphones").getDepth()).isEqualTo(2);
        }

        @Test
        void shouldShareCommonPrefixes() {
            // When
            TaxonomyTree tree = builder.build(List.of("Electronics > Phones", "Electronics > Laptops"));

            // Then
            assertThat(tree.size()).isEqualTo(3);
            assertThat(tree.rootCount()).isEqualTo(1);
            assertThat(tree.childrenOf("electronics"))
                .extracting(TaxonomyNode::getId)
                .containsExactly("electronics-phones", "electronics-laptops");
        }

        @Test
        void shouldSetRootDepthToZeroAndChildDepthToParentPlusOne() {
            TaxonomyTree tree = builder.build(List.of("A > B > C > D"));

            for (TaxonomyNode node : tree.nodes()) {
                if (node.isRoot()) {
                    assertThat(node.getDepth()).isZero();
                } else {
                    assertThat(node.getDepth()).isEqualTo(tree.get(node.getParentId()).getDepth() + 1);
                }
            }
        }

        @Test
        void shouldHumanizeTitlesAndKeepCanonicalPath() {
            TaxonomyTree tree = builder.build(List.of("home_garden/outdoor-furniture"));

            TaxonomyNode leaf = tree.get("home-garden-outdoor-furniture");
            assertThat(leaf.getTitle()).isEqualTo("Outdoor Furniture");
            assertThat(leaf.getPath()).containsExactly("Home Garden", "Outdoor Furniture");
            assertThat(leaf.getCanonicalPath()).isEqualTo("home_garden > outdoor-furniture");
        }

        @Test
        void shouldProduceIdenticalIdsOnRebuild() {
            List<String> paths = List.of("Electronics > Phones", "Home > Kitchen", "Electronics > TV & Audio");

            TaxonomyTree first = builder.build(paths);
            TaxonomyTree second = new TaxonomyBuilder().build(paths);

            assertThat(second.nodes()).extracting(TaxonomyNode::getId)
                .containsExactlyElementsOf(first.nodes().stream().map(TaxonomyNode::getId).toList());
        }

        @Test
        void shouldIgnoreBlankPaths() {
            TaxonomyTree tree = builder.build(List.of("", "  ", "Toys"));

            assertThat(tree.size()).isEqualTo(1);
        }
    }

    @Nested
    class ProductTests {

        @Test
        void shouldAttachProductsToTheirLeaf() {
            // Given
            List<Product> products = List.of(
                Product.of("p1", "Acme Phone", "Electronics > Phones"),
                Product.of("p2", "Acme Laptop", "Electronics > Laptops"));

            // When
            TaxonomyTree tree = builder.buildFromProducts(products, Map.of());

            // Then
            assertThat(tree.get("electronics-phones").getDirectProductIds()).containsExactly("p1");
            assertThat(tree.nodeOfProduct("p2")).map(TaxonomyNode::getId).contains("electronics-laptops");
            assertThat(tree.get("electronics").getDirectProductIds()).isEmpty();
        }

        @Test
        void shouldKeepFirstOwnerOfADuplicateProduct() {
            List<Product> products = List.of(
                Product.of("p1", "Acme Phone", "Electronics > Phones"),
                Product.of("p1", "Acme Phone", "Electronics > Laptops"));

            TaxonomyTree tree = builder.buildFromProducts(products, Map.of());

            assertThat(tree.nodeOfProduct("p1")).map(TaxonomyNode::getId).contains("electronics-phones");
            assertThat(tree.get("electronics-laptops").getDirectProductIds()).isEmpty();
        }

        @Test
        void shouldSkipProductsWithoutCategory() {
            TaxonomyTree tree = builder.buildFromProducts(List.of(Product.of("p1", "Loose", null)), Map.of());

            assertThat(tree.isEmpty()).isTrue();
            assertThat(tree.nodeOfProduct("p1")).isEmpty();
        }

        @Test
        void shouldAttachCategoryUrls() {
            TaxonomyTree tree = builder.build(List.of(), List.of(),
                Map.of("Electronics > Phones", " https://shop.example.com/electronics/phones "));

            assertThat(tree.get("electronics-phones").getUrl()).isEqualTo("https://shop.example.com/electronics/phones");
            assertThat(tree.get("electronics").getUrl()).isNull();
        }
    }

    @Nested
    class ConflictTests {

        @Test
        void shouldThrowOnConflictInStrictMode() {
            // Given - "A-B" and "A > B" slug to the same id with different parents
            TaxonomyBuilder strict = new TaxonomyBuilder(true);

            // When / Then
            assertThatThrownBy(() -> strict.build(List.of("A-B", "A > B")))
                .isInstanceOf(TaxonomyConflictException.class)
                .satisfies(e -> {
                    TaxonomyConflictException conflict = (TaxonomyConflictException) e;
                    assertThat(conflict.getNodeId()).isEqualTo("a-b");
                    assertThat(conflict.getCategoryPath()).isEqualTo("A > B");
                });
        }

        @Test
        void shouldRecordConflictAndContinueInLenientMode() {
            // When
            TaxonomyTree tree = builder.build(List.of("A-B", "A > B", "C > D"));

            // Then
            assertThat(tree.anomalies())
                .extracting(TreeAnomaly::type)
                .containsExactly(AnomalyType.PATH_CONFLICT);
            assertThat(tree.get("a-b").isRoot()).isTrue();
            assertThat(tree.contains("a")).isTrue();
            assertThat(tree.contains("c-d")).isTrue();
        }

        @Test
        void shouldMergeCaseVariantsAndReportThem() {
            TaxonomyTree tree = builder.build(List.of("Electronics > Phones", "electronics > PHONES"));

            assertThat(tree.size()).isEqualTo(2);
            assertThat(tree.anomalies()).extracting(TreeAnomaly::type).contains(AnomalyType.DUPLICATE_PATH);
            assertThat(tree.get("electronics-phones").getCanonicalPath()).isEqualTo("Electronics > Phones");
        }
    }
}
