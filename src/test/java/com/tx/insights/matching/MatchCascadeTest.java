package com.tx.insights.matching;

import com.tx.insights.taxonomy.Product;
import com.tx.insights.taxonomy.TaxonomyBuilder;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * TDD tests for MatchCascade.
 */
class MatchCascadeTest {

    private static final DateRange JANUARY = DateRange.of("2024-01-01", "2024-01-31");

    private MatchCascade cascade;
    private List<MatchWarning> warnings;

    @BeforeEach
    void setUp() {
        List<Product> products = List.of(
            new Product("p1", "Acme Galaxy Phone", "https://shop.example.com/products/acme-galaxy-phone",
                "4006381333931", null, "Electronics > Phones", 499.0, "A phone", "https://img.example.com/p1.jpg"),
            new Product("p2", "Steel Skillet", null, "036000291452", null, "Home > Kitchen > Cookware",
                39.0, null, null),
            new Product("p3", "Loose Gadget", null, null, null, null, 5.0, null, null));
        TaxonomyTree tree = new TaxonomyBuilder().build(List.of(), products,
            Map.of("Electronics > Phones", "https://shop.example.com/electronics/phones"));
        cascade = new MatchCascade(MatchIndex.build(tree, products));
        warnings = new ArrayList<>();
    }

    private MatchResult match(String subject) {
        return cascade.match(MetricFact.builder(subject, MetricSource.SEARCH_CONSOLE, JANUARY).build(), warnings);
    }

    @Nested
    class ExactTests {

        @Test
        void shouldMatchCategoryUrlIgnoringTrailingSlash() {
            // When
            MatchResult result = match("https://shop.example.com/electronics/phones/");

            // Then
            assertThat(result.target()).isEqualTo(MatchTarget.NODE);
            assertThat(result.nodeId()).isEqualTo("electronics-phones");
            assertThat(result.strategy()).isEqualTo(MatchStrategy.EXACT_URL);
            assertThat(result.confidence()).isEqualTo(1.0);
        }

        @Test
        void shouldMatchNodeIdDirectly() {
            assertThat(match("home-kitchen").nodeId()).isEqualTo("home-kitchen");
        }

        @Test
        void shouldMatchProductIdAndAttributeToOwningNode() {
            MatchResult result = match("p1");

            assertThat(result.target()).isEqualTo(MatchTarget.PRODUCT);
            assertThat(result.entityId()).isEqualTo("p1");
            assertThat(result.nodeId()).isEqualTo("electronics-phones");
        }

        @Test
        void shouldMatchProductLinkOnAnotherHostWithSuffixAndQuery() {
            MatchResult result = match("https://www.shop.example.com/products/acme-galaxy-phone.html?utm_source=x");

            assertThat(result.entityId()).isEqualTo("p1");
            assertThat(result.strategy()).isEqualTo(MatchStrategy.EXACT_URL);
        }

        @Test
        void shouldLeaveProductWithoutCategoryUnattributed() {
            MatchResult result = match("p3");

            assertThat(result.isMatched()).isTrue();
            assertThat(result.nodeId()).isNull();
        }
    }

    @Nested
    class GtinTests {

        @Test
        void shouldMatchZeroPaddedGtin() {
            MatchResult result = match("0036000291452");

            assertThat(result.entityId()).isEqualTo("p2");
            assertThat(result.nodeId()).isEqualTo("home-kitchen-cookware");
            assertThat(result.evidence()).isEqualTo(new MatchEvidence.Gtin("36000291452"));
        }

        @Test
        void shouldWarnAndFallThroughOnBadChecksum() {
            MatchResult result = match("4006381333932");

            assertThat(result.isMatched()).isFalse();
            assertThat(warnings).extracting(MatchWarning::type).containsExactly(MatchWarning.Type.INVALID_GTIN);
        }
    }

    @Nested
    class SharedKeyTests {

        private final Product later = new Product("z9", "Relabelled Phone", "https://shop.example.com/products/phone",
            "4006381333931", null, "Electronics > Phones", 450.0, null, null);
        private final Product earlier = new Product("a1", "Original Phone", "https://shop.example.com/products/phone",
            "4006381333931", null, "Electronics > Phones", 499.0, null, null);

        private MatchResult matchAgainst(List<Product> products, String subject) {
            TaxonomyTree tree = new TaxonomyBuilder().build(List.of(), products, Map.of());
            MatchCascade shared = new MatchCascade(MatchIndex.build(tree, products));
            return shared.match(MetricFact.builder(subject, MetricSource.MERCHANT, JANUARY).build(), new ArrayList<>());
        }

        @Test
        void shouldResolveSharedGtinToLowestProductIdInAnyOrder() {
            // When
            MatchResult forward = matchAgainst(List.of(later, earlier), "4006381333931");
            MatchResult reversed = matchAgainst(List.of(earlier, later), "4006381333931");

            // Then
            assertThat(forward.entityId()).isEqualTo("a1");
            assertThat(reversed).isEqualTo(forward);
        }

        @Test
        void shouldResolveSharedLinkToLowestProductIdInAnyOrder() {
            // When
            MatchResult forward = matchAgainst(List.of(later, earlier), "https://shop.example.com/products/phone");
            MatchResult reversed = matchAgainst(List.of(earlier, later), "https://shop.example.com/products/phone");

            // Then
            assertThat(forward.entityId()).isEqualTo("a1");
            assertThat(reversed).isEqualTo(forward);
        }
    }

    @Nested
    class FuzzyTests {

        @Test
        void shouldMatchDeepestPathPrefix() {
            // When
            MatchResult result = match("https://shop.example.com/electronics/phones/iphone-15");

            // Then
            assertThat(result.nodeId()).isEqualTo("electronics-phones");
            assertThat(result.evidence()).isEqualTo(new MatchEvidence.PathPrefix("electronics/phones", 2, 3));
            assertThat(result.confidence()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        void shouldMatchCategoryKeywordAtTokenBoundary() {
            MatchResult result = match("https://blog.example.com/guides/best-cookware-2024");

            assertThat(result.nodeId()).isEqualTo("home-kitchen-cookware");
            assertThat(result.strategy()).isEqualTo(MatchStrategy.CATEGORY_KEYWORD);
            assertThat(result.confidence()).isEqualTo(0.7);
        }

        @Test
        void shouldNotMatchKeywordInsideAnotherWord() {
            assertThat(match("https://shop.example.com/audio/headphones").isMatched()).isFalse();
        }

        @Test
        void shouldMatchProductTitleInUrl() {
            MatchResult result = match("https://shop.example.com/deals/steel-skillet-sale");

            assertThat(result.entityId()).isEqualTo("p2");
            assertThat(result.strategy()).isEqualTo(MatchStrategy.PRODUCT_TITLE);
        }

        @Test
        void shouldMatchProductTitleInPlainText() {
            assertThat(match("Steel Skillet 10 inch").entityId()).isEqualTo("p2");
        }
    }

    @Nested
    class MalformedInputTests {

        @Test
        void shouldWarnOnUnparsableUrl() {
            MatchResult result = match("https://shop.example.com/a b");

            assertThat(result.isMatched()).isFalse();
            assertThat(warnings).extracting(MatchWarning::type).containsExactly(MatchWarning.Type.MALFORMED_URL);
        }

        @Test
        void shouldReturnNoMatchForBlankSubject() {
            assertThat(match("   ")).isEqualTo(MatchResult.noMatch());
            assertThat(warnings).isEmpty();
        }
    }

    @Test
    void shouldRequireTokenBoundaries() {
        assertThat(MatchCascade.containsToken("mobile-phones/x", "phones")).isTrue();
        assertThat(MatchCascade.containsToken("headphones", "phones")).isFalse();
        assertThat(MatchCascade.containsToken("phones", "phones")).isTrue();
        assertThat(MatchCascade.containsToken("headphones/phones", "phones")).isTrue();
        assertThat(MatchCascade.containsToken("anything", "")).isFalse();
    }
}
