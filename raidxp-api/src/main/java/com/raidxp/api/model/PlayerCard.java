package com.raidxp.api.model;

import java.time.Instant;

/**
 * Read-only view of a player and their stats, as served to collaborators.
 *
 * @param displayName unique in-game name
 * @param eligible    whether the player opted in to XP and levels
 * @param lastSeen    timestamp of the last event referencing the player
 * @param kills       kill counter
 * @param deaths      death counter
 * @param extracts    extract counter
 * @param survivals   survival counter
 * @param dogtags     dogtag pickup counter
 * @param xp          total experience
 * @param level       level derived from {@code xp}
 */
public record PlayerCard(
        String displayName,
        boolean eligible,
        Instant lastSeen,
        long kills,
        long deaths,
        long extracts,
        long survivals,
        long dogtags,
        long xp,
        int level) {
}
