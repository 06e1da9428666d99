package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.MatchRecord;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.OpponentBucketStatRecord;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Player sheet for one bracket: heading, points, ranking position, results per opponent rank and
 * the matches grouped per match day.
 *
 * <p>A women's sheet only contributes when it lists matches; men have an empty one.
 */
public class ProfileExtractor implements DocumentExtractor {

    private static final Pattern POINTS = Pattern.compile("([\\d.,]+)\\s*pts");
    private static final Pattern SIGNED_POINTS = Pattern.compile("([+-]?[\\d.,]+)\\s*pts");
    private static final Pattern POSITION = Pattern.compile("(?<!\\d)(\\d{1,9})(?!\\d)");
    private static final Pattern UPDATE_LINE = Pattern.compile("(?i)(mise à jour|update)[^0-9]{0,40}(\\d{1,2}/\\d{1,2}/\\d{2,4})");
    private static final Pattern MATCH_DAY = Pattern.compile(
        "^(\\d{2}/\\d{2}/\\d{4})\\s*-\\s*([A-Z0-9/]+)\\s*-\\s*(.+?)(?:Total|Les points|$)");
    private static final Pattern RANK_TOKEN = Pattern.compile("^(?:[A-Z]\\d|NC)$");
    private static final Pattern SCORE = Pattern.compile("^(\\d{1,9})\\s*-\\s*(\\d{1,9})(?!\\d)");

    private final CompetitionType type;

    public ProfileExtractor(CompetitionType type) {
        this.type = type;
    }

    @Override
    public DocumentKind kind() {
        return type == CompetitionType.WOMEN ? DocumentKind.PROFILE_WOMEN : DocumentKind.PROFILE_MEN;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        String requestedLicence = source.request().parameter(AfttCatalogRequests.LICENCE_PARAM);
        if (type == CompetitionType.WOMEN && isEmptySheet(source.body())) {
            return ExtractionResult.empty();
        }

        Element heading = html.selectFirst("h2");
        if (heading == null && type == CompetitionType.WOMEN) {
            return ExtractionResult.empty();
        }
        if (heading == null) {
            throw new ExtractionException("No profile heading for licence " + requestedLicence, html.text());
        }
        CompositeLine line = CompositeLineParser.parse(HtmlText.text(heading))
            .orElseThrow(() -> new ExtractionException("Unrecognized profile heading", HtmlText.text(heading)));
        String licence = line.id();

        List<ExtractedRecord> matches = readMatches(html, licence);
        if (type == CompetitionType.WOMEN && matches.isEmpty()) {
            return ExtractionResult.empty();
        }

        Field<Double> pointsStart = Field.absent();
        Field<Double> pointsCurrent = Field.absent();
        Field<Integer> position = Field.absent();
        String lastH5 = "";
        for (Element element : html.getAllElements()) {
            if (element.normalName().equals("h5")) {
                lastH5 = HtmlText.lower(HtmlText.text(element));
            } else if (element.normalName().equals("h3")) {
                String text = HtmlText.text(element);
                Matcher points = POINTS.matcher(text);
                if (points.find()) {
                    Field<Double> value = HtmlText.decimal(points.group(1));
                    if (lastH5.contains("part") || lastH5.contains("start")) {
                        pointsStart = value;
                    } else if (lastH5.contains("actuel") || lastH5.contains("current")) {
                        pointsCurrent = value;
                    }
                } else if (text.endsWith("e") || text.endsWith("ème")) {
                    Matcher digits = POSITION.matcher(text);
                    if (digits.find()) {
                        position = Field.of(Integer.parseInt(digits.group(1)));
                    }
                }
            }
        }

        List<OpponentBucketStatRecord> stats = readStats(html, licence);
        Field<Integer> totalWins = stats.isEmpty() ? Field.absent()
            : Field.of(stats.stream().mapToInt(OpponentBucketStatRecord::wins).sum());
        Field<Integer> totalLosses = stats.isEmpty() ? Field.absent()
            : Field.of(stats.stream().mapToInt(OpponentBucketStatRecord::losses).sum());

        MemberRecord member = new MemberRecord(licence);
        if (type == CompetitionType.MEN) {
            member.name(line.name())
                .rank(line.rank())
                .pointsStart(pointsStart)
                .pointsCurrent(pointsCurrent)
                .rankingPosition(position)
                .totalWins(totalWins)
                .totalLosses(totalLosses)
                .lastUpdate(lastUpdate(html));
        } else {
            member.womenRank(line.rank())
                .womenPointsStart(pointsStart)
                .womenPointsCurrent(pointsCurrent)
                .womenTotalWins(totalWins)
                .womenTotalLosses(totalLosses);
        }

        List<ExtractedRecord> records = new ArrayList<>();
        records.add(member);
        records.addAll(matches);
        records.addAll(stats);
        return new ExtractionResult(records, List.of());
    }

    private static boolean isEmptySheet(String body) {
        return body.contains("Warning") && body.contains("Undefined array key");
    }

    private static Field<LocalDate> lastUpdate(Document html) {
        Matcher matcher = UPDATE_LINE.matcher(html.text());
        if (!matcher.find()) {
            return Field.absent();
        }
        return Field.of(DateRangeParser.findDate(matcher.group(2)).orElse(null));
    }

    private List<OpponentBucketStatRecord> readStats(Document html, String licence) {
        Element table = html.selectFirst("table");
        if (table == null) {
            return List.of();
        }
        List<String> buckets = new ArrayList<>();
        Map<String, Integer> wins = new LinkedHashMap<>();
        Map<String, Integer> losses = new LinkedHashMap<>();
        Map<String, Double> ratios = new LinkedHashMap<>();

        for (Element row : table.select("tr")) {
            List<String> cells = HtmlText.cellTexts(row);
            if (cells.isEmpty()) {
                continue;
            }
            String label = HtmlText.lower(cells.get(0));
            List<String> values = cells.subList(1, cells.size());
            if (buckets.isEmpty() && cells.size() > 1) {
                buckets.addAll(values);
            } else if (label.contains("victoire") || label.contains("win")) {
                fill(buckets, values, wins, text -> HtmlText.integer(text).orElse(null));
            } else if (label.contains("faite") || label.contains("loss")) {
                fill(buckets, values, losses, text -> HtmlText.integer(text).orElse(null));
            } else if (label.contains("ratio") || label.contains("%")) {
                fill(buckets, values, ratios, text -> HtmlText.decimal(text).orElse(null));
            }
        }

        List<OpponentBucketStatRecord> stats = new ArrayList<>();
        for (String bucket : buckets) {
            if (bucket.isEmpty()) {
                continue;
            }
            stats.add(new OpponentBucketStatRecord(licence, type, bucket,
                wins.getOrDefault(bucket, 0), losses.getOrDefault(bucket, 0), Field.of(ratios.get(bucket))));
        }
        return stats;
    }

    private static <T> void fill(List<String> buckets, List<String> values, Map<String, T> target,
                                 Function<String, T> parser) {
        for (int i = 0; i < values.size() && i < buckets.size(); i++) {
            T value = parser.apply(values.get(i));
            if (value != null) {
                target.put(buckets.get(i), value);
            }
        }
    }

    private List<ExtractedRecord> readMatches(Document html, String licence) {
        List<ExtractedRecord> matches = new ArrayList<>();
        for (Element card : html.select("div.card")) {
            Element header = card.selectFirst(".card-header");
            if (header == null) {
                continue;
            }
            Matcher day = MATCH_DAY.matcher(HtmlText.text(header));
            if (!day.find()) {
                continue;
            }
            Optional<LocalDate> date = DateRangeParser.findDate(day.group(1));
            if (date.isEmpty()) {
                continue;
            }
            Field<String> division = Field.ofText(day.group(2));
            Field<String> opponentClub = Field.ofText(day.group(3));

            for (Element matchCard : card.select(".match-card")) {
                matches.add(readMatch(matchCard, licence, date.get(), division, opponentClub));
            }
        }
        return matches;
    }

    private MatchRecord readMatch(Element matchCard, String licence, LocalDate date, Field<String> division,
                                  Field<String> opponentClub) {
        Field<String> opponentName = Field.ofText(HtmlText.text(matchCard.selectFirst("h6")));
        Element licenceInput = matchCard.selectFirst("input[name=licence]");
        Field<String> opponentLicence = licenceInput == null ? Field.absent() : Field.ofText(licenceInput.attr("value"));

        Field<String> opponentRank = Field.absent();
        Field<Double> opponentPoints = Field.absent();
        for (Element small : matchCard.select("small")) {
            String text = HtmlText.text(small);
            if (RANK_TOKEN.matcher(text).matches()) {
                opponentRank = Field.of(text);
            } else if (text.contains("pts")) {
                Matcher points = POINTS.matcher(text);
                if (points.find()) {
                    opponentPoints = HtmlText.decimal(points.group(1));
                }
            }
        }

        Field<String> score = Field.ofText(HtmlText.text(matchCard.selectFirst("h5.fw-bold")));
        Field<Boolean> won = score.map(SCORE::matcher)
            .map(matcher -> matcher.find() ? Integer.parseInt(matcher.group(1)) > Integer.parseInt(matcher.group(2)) : null);

        Field<Double> pointsDelta = Field.absent();
        Element badge = matchCard.selectFirst(".badge");
        if (badge != null) {
            Matcher delta = SIGNED_POINTS.matcher(HtmlText.text(badge));
            if (delta.find()) {
                pointsDelta = HtmlText.decimal(delta.group(1));
            }
        }

        return new MatchRecord(licence, type, date, division, opponentLicence, opponentName)
            .opponentRank(opponentRank)
            .opponentPoints(opponentPoints)
            .opponentClub(opponentClub)
            .score(score)
            .won(won)
            .pointsDelta(pointsDelta);
    }
}
