package com.tx.insights.matching;

import com.tx.insights.taxonomy.CategoryPaths;
import com.tx.insights.taxonomy.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a single subject key through the ordered strategies; the first hit wins.
 *
 * <ol>
 *   <li>exact identifier or URL (product id, node id, category URL, product link)</li>
 *   <li>valid GTIN against catalog GTINs</li>
 *   <li>deepest category whose path prefixes the URL path</li>
 *   <li>category title contained in the URL path</li>
 *   <li>product title contained in the subject</li>
 * </ol>
 *
 * Never throws for malformed input: unparsable URLs and bad GTINs are reported through the
 * warning list and resolve to no match for that candidate.
 */
public class MatchCascade {

    private static final Logger log = LoggerFactory.getLogger(MatchCascade.class);

    static final double EXACT_CONFIDENCE = 1.0;
    static final double PATH_PREFIX_FLOOR = 0.8;
    static final double PATH_PREFIX_SPAN = 0.15;
    static final double KEYWORD_CONFIDENCE = 0.7;

    private final MatchIndex index;

    public MatchCascade(MatchIndex index) {
        this.index = index;
    }

    public MatchResult match(MetricFact fact, List<MatchWarning> warnings) {
        String key = fact.subjectKey() == null ? "" : fact.subjectKey().strip();
        if (key.isEmpty()) {
            return MatchResult.noMatch();
        }

        boolean url = UrlNormalizer.looksLikeUrl(key);
        String path = null;
        if (url) {
            Optional<String> normalized = UrlNormalizer.normalizePath(key);
            if (normalized.isEmpty()) {
                warnings.add(new MatchWarning(MatchWarning.Type.MALFORMED_URL, fact.key(), key,
                    "URL cannot be parsed"));
                return MatchResult.noMatch();
            }
            path = normalized.get();
        }

        MatchResult result = matchExact(key, path);
        if (result == null && !url) {
            result = matchGtin(fact, key, warnings);
        }
        if (result == null && path != null) {
            List<String> segments = UrlNormalizer.slugSegments(path);
            result = matchPathPrefix(segments);
            if (result == null) {
                result = matchCategoryKeyword(String.join("/", segments));
            }
        }
        if (result == null) {
            String text = path != null ? String.join("/", UrlNormalizer.slugSegments(path)) : CategoryPaths.slug(key);
            result = matchProductTitle(text);
        }

        if (result == null) {
            log.debug("No match for {}", key);
            return MatchResult.noMatch();
        }
        return result;
    }

    private MatchResult matchExact(String key, String path) {
        Optional<Product> product = index.productById(key);
        if (product.isPresent()) {
            return productResult(product.get().id(), EXACT_CONFIDENCE, new MatchEvidence.ExactUrl(key));
        }
        if (index.tree().contains(key)) {
            return MatchResult.node(key, EXACT_CONFIDENCE, new MatchEvidence.ExactUrl(key));
        }
        if (path == null) {
            return null;
        }
        Optional<String> node = index.nodeByUrlPath(path);
        if (node.isPresent()) {
            return MatchResult.node(node.get(), EXACT_CONFIDENCE, new MatchEvidence.ExactUrl(path));
        }
        return index.productByLinkPath(path)
            .map(productId -> productResult(productId, EXACT_CONFIDENCE, new MatchEvidence.ExactUrl(path)))
            .orElse(null);
    }

    private MatchResult matchGtin(MetricFact fact, String key, List<MatchWarning> warnings) {
        if (!GtinValidator.looksLikeGtin(key)) {
            return null;
        }
        if (!GtinValidator.isValid(key)) {
            warnings.add(new MatchWarning(MatchWarning.Type.INVALID_GTIN, fact.key(), key,
                "GTIN fails checksum"));
            return null;
        }
        String canonical = GtinValidator.canonical(key);
        return index.productByCanonicalGtin(canonical)
            .map(productId -> productResult(productId, EXACT_CONFIDENCE, new MatchEvidence.Gtin(canonical)))
            .orElse(null);
    }

    private MatchResult matchPathPrefix(List<String> segments) {
        int total = segments.size();
        for (int k = Math.min(total, index.maxPathSegments()); k >= 1; k--) {
            String prefix = String.join("/", segments.subList(0, k));
            Optional<String> node = index.nodeBySlugPath(prefix);
            if (node.isPresent()) {
                double confidence = PATH_PREFIX_FLOOR + PATH_PREFIX_SPAN * k / total;
                return MatchResult.node(node.get(), confidence, new MatchEvidence.PathPrefix(prefix, k, total));
            }
        }
        return null;
    }

    private MatchResult matchCategoryKeyword(String text) {
        for (MatchIndex.Keyword keyword : index.categoryKeywords()) {
            if (containsToken(text, keyword.slug())) {
                return MatchResult.node(keyword.entityId(), KEYWORD_CONFIDENCE,
                    new MatchEvidence.CategoryKeyword(keyword.slug()));
            }
        }
        return null;
    }

    private MatchResult matchProductTitle(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (MatchIndex.Keyword title : index.productTitles()) {
            if (containsToken(text, title.slug())) {
                return productResult(title.entityId(), KEYWORD_CONFIDENCE,
                    new MatchEvidence.ProductTitle(title.slug()));
            }
        }
        return null;
    }

    private MatchResult productResult(String productId, double confidence, MatchEvidence evidence) {
        return MatchResult.product(productId, index.owningNode(productId), confidence, evidence);
    }

    /**
     * Containment at slug token boundaries: "phones" matches "mobile-phones/x" but not "headphones".
     */
    static boolean containsToken(String text, String token) {
        if (token.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int at = text.indexOf(token, from);
            if (at < 0) {
                return false;
            }
            int end = at + token.length();
            boolean startOk = at == 0 || isBoundary(text.charAt(at - 1));
            boolean endOk = end == text.length() || isBoundary(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = at + 1;
        }
    }

    private static boolean isBoundary(char c) {
        return c == '-' || c == '/';
    }
}
