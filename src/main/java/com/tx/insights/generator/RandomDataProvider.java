package com.tx.insights.generator;

import com.tx.insights.matching.GtinValidator;
import com.tx.insights.matching.MetricSource;
import net.datafaker.Faker;

import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Seeded random data for synthetic catalogs. The same seed yields the same sequence, so an
 * instance must be used from one thread at a time.
 */
public class RandomDataProvider {

    // Share of each source in generated traffic
    private static final List<SourceWeight> SOURCE_WEIGHTS = List.of(
        new SourceWeight(MetricSource.SEARCH_CONSOLE, 5.0),
        new SourceWeight(MetricSource.ANALYTICS, 3.0),
        new SourceWeight(MetricSource.MERCHANT, 2.0)
    );

    private static final List<String> DOMAINS = List.of(
        "shop.example.com", "store.example.com", "www.example-market.com"
    );

    private record SourceWeight(MetricSource source, double weight) {}

    private final Random random;
    private final Faker faker;

    public RandomDataProvider(long seed) {
        this.random = new Random(seed);
        this.faker = new Faker(Locale.ENGLISH, random);
    }

    public Faker faker() {
        return faker;
    }

    public Random random() {
        return random;
    }

    public String domain() {
        return randomChoice(DOMAINS);
    }

    public String department() {
        return faker.commerce().department();
    }

    /**
     * Last word of a generated product name, e.g. "Chair" or "Keyboard".
     */
    public String productNoun() {
        String name = faker.commerce().productName();
        return name.substring(name.lastIndexOf(' ') + 1);
    }

    public String material() {
        return faker.commerce().material();
    }

    public String productTitle() {
        return faker.commerce().brand() + " " + faker.commerce().productName();
    }

    public String description() {
        return randomBoolean(0.75) ? faker.lorem().paragraph(3) : faker.lorem().sentence(4);
    }

    public double price() {
        return Math.round((5 + random.nextDouble() * 495) * 100.0) / 100.0;
    }

    /**
     * A 13-digit GTIN with a correct check digit.
     */
    public String gtin13() {
        StringBuilder body = new StringBuilder(12);
        body.append(randomInt(1, 9));
        for (int i = 1; i < 12; i++) {
            body.append(random.nextInt(10));
        }
        return body.toString() + GtinValidator.checkDigit(body.toString());
    }

    /**
     * Same as {@link #gtin13()} with the check digit off by one.
     */
    public String invalidGtin13() {
        String valid = gtin13();
        int check = valid.charAt(12) - '0';
        return valid.substring(0, 12) + ((check + 1) % 10);
    }

    public MetricSource source() {
        double totalWeight = SOURCE_WEIGHTS.stream().mapToDouble(SourceWeight::weight).sum();
        double rand = random.nextDouble() * totalWeight;
        double cumulative = 0;
        for (SourceWeight sw : SOURCE_WEIGHTS) {
            cumulative += sw.weight();
            if (rand <= cumulative) {
                return sw.source();
            }
        }
        return SOURCE_WEIGHTS.get(SOURCE_WEIGHTS.size() - 1).source();
    }

    public String slugWords(int words) {
        return String.join("-", faker.lorem().words(words)).toLowerCase(Locale.ROOT);
    }

    public int randomInt(int min, int max) {
        return random.nextInt(max - min + 1) + min;
    }

    public long randomLong(long min, long max) {
        return min + (long) (random.nextDouble() * (max - min + 1));
    }

    public double randomDouble() {
        return random.nextDouble();
    }

    public boolean randomBoolean(double trueProbability) {
        return random.nextDouble() < trueProbability;
    }

    public <T> T randomChoice(List<T> choices) {
        return choices.get(random.nextInt(choices.size()));
    }
}
