package org.politia.warehouse.resolve;

import org.politia.warehouse.entity.Person;
import org.politia.warehouse.error.AmbiguousMatchException;
import org.politia.warehouse.merge.CanonicalIds;
import org.politia.warehouse.normalize.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a free-text transcript speaker to a person id.
 *
 * <p>The normalized name is tried against the roster in a fixed order, and the first step that finds
 * exactly one person wins:</p>
 * <ol>
 *   <li>exact key</li>
 *   <li>tokens reversed</li>
 *   <li>first token as surname: {@code given... SURNAME}</li>
 *   <li>last token as surname: {@code SURNAME given...}</li>
 *   <li>surname (last token) plus first given name (first token)</li>
 *   <li>surname alone, only when a single person has it</li>
 * </ol>
 * <p>When every step fails the speaker gets a placeholder id derived from the normalized name, so
 * the same unknown speaker maps to the same placeholder on every run. Never throws, never logs.</p>
 */
public class SpeakerResolver {

    private final SpeakerRoster roster;

    public SpeakerResolver(SpeakerRoster roster) {
        this.roster = roster;
    }

    public SpeakerResolution resolve(String rawName) {
        String normalized = TextNormalizer.normalizeName(rawName);
        List<String> tokens = normalized.isEmpty() ? List.of() : Arrays.asList(normalized.split(" "));
        int n = tokens.size();

        if (n > 0) {
            Optional<String> exact = roster.lookup(normalized);
            if (exact.isPresent()) {
                return matched(rawName, normalized, exact.get(), MatchStrategy.EXACT);
            }
        }

        if (n >= 2) {
            List<String> reversed = new ArrayList<>(tokens);
            Collections.reverse(reversed);
            Optional<String> match = roster.lookup(String.join(" ", reversed));
            if (match.isPresent()) {
                return matched(rawName, normalized, match.get(), MatchStrategy.REVERSED);
            }

            String surnameFirst = String.join(" ", tokens.subList(1, n)) + " " + tokens.get(0);
            match = roster.lookup(surnameFirst);
            if (match.isPresent()) {
                return matched(rawName, normalized, match.get(), MatchStrategy.SURNAME_FIRST);
            }

            String givenFirst = tokens.get(n - 1) + " " + String.join(" ", tokens.subList(0, n - 1));
            match = roster.lookup(givenFirst);
            if (match.isPresent()) {
                return matched(rawName, normalized, match.get(), MatchStrategy.GIVEN_FIRST);
            }

            Set<String> candidates = roster.bySurnameAndFirstGiven(tokens.get(n - 1), tokens.get(0));
            if (candidates.size() == 1) {
                return matched(rawName, normalized, candidates.iterator().next(), MatchStrategy.SURNAME_AND_FIRST_GIVEN);
            }
        }

        boolean ambiguous = false;
        if (n > 0) {
            try {
                Optional<String> bySurname = roster.uniqueBySurname(tokens.get(n - 1));
                if (bySurname.isPresent()) {
                    return matched(rawName, normalized, bySurname.get(), MatchStrategy.SURNAME_ONLY);
                }
            } catch (AmbiguousMatchException e) {
                ambiguous = true;
            }
        }

        return placeholder(rawName, normalized, ambiguous);
    }

    private static SpeakerResolution matched(String rawName, String normalized, String personId, MatchStrategy strategy) {
        return SpeakerResolution.builder()
            .rawName(rawName)
            .normalizedName(normalized)
            .personId(personId)
            .strategy(strategy)
            .build();
    }

    private static SpeakerResolution placeholder(String rawName, String normalized, boolean ambiguous) {
        String trimmed = TextNormalizer.normalizeText(rawName);
        List<String> rawTokens = TextNormalizer.words(rawName);
        String given = rawTokens.size() > 1 ? rawTokens.get(0) : "";
        String family = rawTokens.isEmpty() ? "" : rawTokens.get(rawTokens.size() - 1);

        // the id hashes the full normalized name, so clipping the stored names keeps it stable
        return SpeakerResolution.builder()
            .rawName(rawName)
            .normalizedName(normalized)
            .personId(CanonicalIds.placeholderPersonId(normalized))
            .strategy(MatchStrategy.PLACEHOLDER)
            .ambiguous(ambiguous)
            .placeholderFullName(clip(trimmed.isEmpty() ? "Unknown" : trimmed))
            .placeholderGivenName(clip(given))
            .placeholderFamilyName(clip(family))
            .build();
    }

    private static String clip(String name) {
        return name.length() <= Person.NAME_LENGTH ? name : name.substring(0, Person.NAME_LENGTH);
    }
}
