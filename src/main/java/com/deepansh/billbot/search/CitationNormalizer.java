package com.deepansh.billbot.search;

import com.deepansh.billbot.model.Citation;
import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.ResultRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw search record into a {@link Citation}. Stateless, no I/O.
 *
 * Excerpt: the sentence of the summary (or title) with the most query-term hits,
 * terms highlighted as {@code **term**}, capped at 300 characters.
 */
@Component
public class CitationNormalizer {

    static final int EXCERPT_LIMIT = 300;
    static final int FALLBACK_EXCERPT_LIMIT = 200;

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern HOUSE_BILL = Pattern.compile("^h\\.?\\s*r\\.?\\s*(\\d+)$");
    private static final Pattern SENATE_BILL = Pattern.compile("^s\\.?\\s*(\\d+)$");

    private final Clock clock;

    public CitationNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Citation normalize(ResultRecord record, CitationContext context) {
        Map<String, Object> raw = record.getSourceMetadata() != null ? record.getSourceMetadata() : Map.of();
        List<String> terms = queryTerms(context.query());
        boolean bill = record.getContentType() == ContentType.BILL;

        Citation.CitationBuilder builder = Citation.builder()
                .id(record.getContentType().wireName() + ":" + record.getContentId())
                .type(record.getContentType())
                .title(nz(record.getTitle()).isBlank() ? (bill ? "Untitled Bill" : "Untitled Executive Action") : record.getTitle())
                .relevanceScore(record.getRelevanceScore())
                .excerpt(excerpt(record, terms))
                .searchContext(Citation.SearchContext.builder()
                        .query(context.query())
                        .searchMethod(context.searchMethod())
                        .rank(context.rank())
                        .searchTimestamp(context.timestamp().toString())
                        .iterationsUsed(context.iterationsUsed())
                        .build())
                .relevanceIndicators(indicators(record, terms))
                .sourceMetadata(raw);

        if (bill) {
            String billNumber = str(raw, "billNumber", "bill_number");
            String sponsor = str(raw, "sponsor");
            String introduced = str(raw, "introducedDate", "introduced_date");
            builder.billNumber(billNumber)
                    .sponsor(sponsor)
                    .chamber(str(raw, "chamber"))
                    .status(str(raw, "status"))
                    .introducedDate(introduced)
                    .committee(str(raw, "committee"))
                    .url(billUrl(raw, billNumber))
                    .source(Citation.Source.builder()
                            .name("U.S. Congress")
                            .type("congressional")
                            .publishedDate(introduced)
                            .author(sponsor)
                            .build());
        } else {
            String signed = str(raw, "signedDate", "signed_date");
            String president = str(raw, "presidentName", "president_name");
            Integer eoNumber = integer(raw, "executiveOrderNumber", "executive_order_number");
            String actionType = str(raw, "actionType", "action_type");
            builder.executiveOrderNumber(eoNumber)
                    .actionType(actionType)
                    .administration(str(raw, "administration"))
                    .presidentName(president)
                    .signedDate(signed)
                    .status(str(raw, "status"))
                    .citation(str(raw, "citation"))
                    .agencies(strings(raw, "agenciesAffected", "agencies"))
                    .url(executiveActionUrl(raw, actionType, eoNumber))
                    .source(Citation.Source.builder()
                            .name("The White House")
                            .type("whitehouse")
                            .publishedDate(signed)
                            .author(president)
                            .build());
        }
        return builder.build();
    }

    // ─── Excerpt ──────────────────────────────────────────────────────────────

    /** Lower-cased query words longer than two characters. */
    static List<String> queryTerms(String query) {
        if (query == null || query.isBlank()) return List.of();
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .map(t -> t.replaceAll("[^\\p{L}\\p{N}-]", ""))
                .filter(t -> t.length() > 2)
                .filter(t -> !t.equals("and") && !t.equals("not"))
                .distinct()
                .toList();
    }

    String excerpt(ResultRecord record, List<String> terms) {
        String text = !nz(record.getSummary()).isBlank() ? record.getSummary() : nz(record.getTitle());
        if (terms.isEmpty()) {
            return text.length() > FALLBACK_EXCERPT_LIMIT ? text.substring(0, FALLBACK_EXCERPT_LIMIT) + "..." : text;
        }

        String[] sentences = SENTENCE_SPLIT.split(text);
        String best = sentences.length > 0 ? sentences[0] : text;
        int bestScore = 0;
        for (String sentence : sentences) {
            int score = hits(sentence, terms);
            if (score > bestScore) {
                bestScore = score;
                best = sentence;
            }
        }

        // cut before highlighting so markers are never split
        String sentence = best.trim();
        boolean truncated = sentence.length() > EXCERPT_LIMIT;
        if (truncated) sentence = sentence.substring(0, EXCERPT_LIMIT);
        String excerpt = highlight(sentence, terms);
        return truncated ? excerpt + "..." : excerpt;
    }

    private static int hits(String text, List<String> terms) {
        String lower = text.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (lower.contains(term)) score++;
        }
        return score;
    }

    private static String highlight(String text, List<String> terms) {
        String out = text;
        for (String term : terms) {
            Matcher m = Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE).matcher(out);
            out = m.replaceAll(r -> "**" + Matcher.quoteReplacement(r.group()) + "**");
        }
        return out;
    }

    private Citation.RelevanceIndicators indicators(ResultRecord record, List<String> terms) {
        int titleHits = hits(nz(record.getTitle()), terms);
        int summaryHits = hits(nz(record.getSummary()), terms);
        double denominator = terms.isEmpty() ? 1.0 : terms.size();
        return Citation.RelevanceIndicators.builder()
                .termMatches(titleHits + summaryHits)
                .titleRelevance(round(titleHits / denominator))
                .summaryRelevance(round(summaryHits / denominator))
                .recency(recency(record.getDate()))
                .build();
    }

    /** 1.0 for today, falling linearly to 0.0 at five years old. */
    private double recency(LocalDate date) {
        if (date == null) return 0.0;
        long days = ChronoUnit.DAYS.between(date, LocalDate.now(clock));
        return round(Math.max(0.0, Math.min(1.0, 1.0 - days / (365.0 * 5))));
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    // ─── URLs ─────────────────────────────────────────────────────────────────

    static String billUrl(Map<String, Object> raw, String billNumber) {
        String official = str(raw, "sourceUrl", "officialUrl", "source_url");
        if (official != null) return official;
        if (billNumber == null) return "https://www.congress.gov/";

        String normalized = billNumber.trim().toLowerCase(Locale.ROOT);
        Integer congress = integer(raw, "congressNumber", "congress_number", "congress");
        if (congress != null) {
            Matcher house = HOUSE_BILL.matcher(normalized);
            if (house.matches()) {
                return "https://www.congress.gov/bill/" + ordinal(congress) + "-congress/house-bill/" + house.group(1);
            }
            Matcher senate = SENATE_BILL.matcher(normalized);
            if (senate.matches()) {
                return "https://www.congress.gov/bill/" + ordinal(congress) + "-congress/senate-bill/" + senate.group(1);
            }
        }
        return "https://congress.gov/bill/" + normalized.replaceAll("[\\s.]", "");
    }

    static String executiveActionUrl(Map<String, Object> raw, String actionType, Integer eoNumber) {
        String content = str(raw, "contentUrl", "content_url");
        if (content != null) return content;
        if ("executive_order".equals(actionType) && eoNumber != null) {
            return "https://www.federalregister.gov/executive-order/" + eoNumber;
        }
        return "https://www.whitehouse.gov/presidential-actions/";
    }

    private static String ordinal(int n) {
        int mod100 = n % 100;
        if (mod100 >= 11 && mod100 <= 13) return n + "th";
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }

    // ─── Raw field access ─────────────────────────────────────────────────────

    private static String str(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object v = raw.get(key);
            if (v != null && !(v instanceof Map) && !(v instanceof List)) {
                String s = v.toString();
                if (!s.isBlank()) return s;
            }
        }
        return null;
    }

    private static Integer integer(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object v = raw.get(key);
            if (v instanceof Number n && n.longValue() >= 0 && n.longValue() <= Integer.MAX_VALUE) return n.intValue();
            // nine digits always fit an int
            if (v instanceof String s && s.matches("\\d{1,9}")) return Integer.parseInt(s);
        }
        return null;
    }

    private static List<String> strings(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            if (raw.get(key) instanceof List<?> list && !list.isEmpty()) {
                List<String> out = new ArrayList<>();
                list.forEach(item -> out.add(String.valueOf(item)));
                return out;
            }
        }
        return null;
    }

    /** Where and how a record was found. */
    public record CitationContext(String query, String searchMethod, int rank, int iterationsUsed, Instant timestamp) {
    }
}
