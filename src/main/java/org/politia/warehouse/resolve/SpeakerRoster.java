package org.politia.warehouse.resolve;

import org.politia.warehouse.error.AmbiguousMatchException;
import org.politia.warehouse.normalize.TextNormalizer;
import org.politia.warehouse.repository.KnownPerson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable index of known person names in normalized form.
 *
 * <p>Each person is reachable under its normalized full name and under both orderings of family and
 * given name. A key shared by several persons is ambiguous and never resolves.</p>
 */
public final class SpeakerRoster {

    private final Map<String, Set<String>> personIdsByKey;
    private final Map<String, Set<String>> personIdsBySurname;
    private final Map<String, List<String[]>> keyTokensByPerson;

    private SpeakerRoster(Map<String, Set<String>> personIdsByKey,
                          Map<String, Set<String>> personIdsBySurname,
                          Map<String, List<String[]>> keyTokensByPerson) {
        this.personIdsByKey = personIdsByKey;
        this.personIdsBySurname = personIdsBySurname;
        this.keyTokensByPerson = keyTokensByPerson;
    }

    public static SpeakerRoster of(Collection<KnownPerson> persons) {
        Map<String, Set<String>> byKey = new HashMap<>();
        Map<String, Set<String>> bySurname = new HashMap<>();
        Map<String, List<String[]>> tokensByPerson = new HashMap<>();

        for (KnownPerson person : persons) {
            String family = TextNormalizer.normalizeName(person.getFamilyName());
            String given = TextNormalizer.normalizeName(person.getGivenName());
            String full = TextNormalizer.normalizeName(person.getFullName());

            Set<String> keys = new LinkedHashSet<>();
            if (!full.isEmpty()) {
                keys.add(full);
            }
            if (!family.isEmpty() && !given.isEmpty()) {
                keys.add(family + " " + given);
                keys.add(given + " " + family);
            }
            List<String[]> tokenLists = new ArrayList<>();
            for (String key : keys) {
                byKey.computeIfAbsent(key, k -> new TreeSet<>()).add(person.getPersonId());
                tokenLists.add(key.split(" "));
            }
            tokensByPerson.put(person.getPersonId(), tokenLists);

            String surname = lastToken(family.isEmpty() ? full : family);
            if (!surname.isEmpty()) {
                bySurname.computeIfAbsent(surname, k -> new TreeSet<>()).add(person.getPersonId());
            }
        }
        return new SpeakerRoster(byKey, bySurname, tokensByPerson);
    }

    /**
     * The single person indexed under {@code key}, if exactly one is.
     */
    public Optional<String> lookup(String key) {
        Set<String> ids = personIdsByKey.get(key);
        if (ids == null || ids.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(ids.iterator().next());
    }

    /**
     * Persons with a name key that starts and ends with the two tokens, in either role.
     */
    public Set<String> bySurnameAndFirstGiven(String surname, String firstGiven) {
        Set<String> candidates = new TreeSet<>();
        for (Map.Entry<String, List<String[]>> entry : keyTokensByPerson.entrySet()) {
            for (String[] tokens : entry.getValue()) {
                if (tokens.length < 2) {
                    continue;
                }
                String first = tokens[0];
                String last = tokens[tokens.length - 1];
                if ((last.equals(surname) && first.equals(firstGiven))
                    || (first.equals(surname) && last.equals(firstGiven))) {
                    candidates.add(entry.getKey());
                    break;
                }
            }
        }
        return candidates;
    }

    /**
     * The only person carrying {@code surname}, empty when nobody does.
     *
     * @throws AmbiguousMatchException when two or more persons share the surname
     */
    public Optional<String> uniqueBySurname(String surname) throws AmbiguousMatchException {
        Set<String> ids = personIdsBySurname.get(surname);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        if (ids.size() > 1) {
            throw new AmbiguousMatchException(surname, new ArrayList<>(ids));
        }
        return Optional.of(ids.iterator().next());
    }

    public int size() {
        return keyTokensByPerson.size();
    }

    private static String lastToken(String normalized) {
        return normalized.substring(normalized.lastIndexOf(' ') + 1);
    }
}
