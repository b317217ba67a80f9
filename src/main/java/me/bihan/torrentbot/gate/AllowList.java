package me.bihan.torrentbot.gate;

import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed set of user ids allowed to submit torrents. Immutable once built,
 * so it is shared between handler threads without locking.
 */
@Log4j2
public final class AllowList {

    private final Set<Long> userIds;

    private AllowList(Set<Long> userIds) {
        this.userIds = Collections.unmodifiableSet(userIds);
    }

    /**
     * Parses a comma-separated list of numeric ids. Entries that are not numbers
     * are left out with a warning; blank entries are skipped quietly.
     */
    public static AllowList parse(String commaSeparatedIds) {
        Set<Long> ids = new LinkedHashSet<>();
        if (commaSeparatedIds != null) {
            for (String entry : commaSeparatedIds.split(",")) {
                String trimmed = entry.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    ids.add(Long.parseLong(trimmed));
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed allow-list entry '{}'", trimmed);
                }
            }
        }
        if (ids.isEmpty()) {
            log.warn("Allow-list is empty, every message will be ignored");
        }
        log.info("Allowed user ids: {}", ids);
        return new AllowList(ids);
    }

    public static AllowList of(Long... ids) {
        return new AllowList(new LinkedHashSet<>(Set.of(ids)));
    }

    public boolean isAllowed(Long userId) {
        return userId != null && userIds.contains(userId);
    }

    public Set<Long> getUserIds() {
        return userIds;
    }

    public int size() {
        return userIds.size();
    }
}
