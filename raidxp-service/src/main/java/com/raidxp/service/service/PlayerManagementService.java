package com.raidxp.service.service;

import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.repository.PlayerRepository;

import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Administrative player operations.
 */
public class PlayerManagementService {
    private static final Logger logger = Logger.getLogger(PlayerManagementService.class.getName());

    private final JdbcStore store;
    private final PlayerRepository players = new PlayerRepository();
    private final Clock clock;

    public PlayerManagementService(JdbcStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Opts a player in to or out of XP and levels. Unseen players are created.
     * Past XP is left as it is in both directions.
     */
    public void setEligible(String displayName, boolean eligible) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name cannot be blank");
        }
        store.inTransaction("set eligibility for " + displayName, conn -> {
            Optional<PlayerRepository.PlayerRow> player = players.findForUpdate(conn, displayName);
            if (player.isPresent()) {
                players.setEligible(conn, player.get().id(), eligible);
            } else {
                players.create(conn, displayName, eligible, clock.instant());
            }
            return null;
        });
        logger.info("Player " + displayName + (eligible ? " opted in to" : " opted out of") + " XP");
    }
}
