package com.raidxp.service.service;

import com.raidxp.service.MutableClock;
import com.raidxp.service.StoreFixture;
import com.raidxp.service.repository.JdbcStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerManagementServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private PlayerManagementService service;
    private ProgressionQueryService queries;

    @BeforeEach
    void setUp() {
        JdbcStore store = StoreFixture.newStore();
        service = new PlayerManagementService(store, new MutableClock(NOW));
        queries = new ProgressionQueryService(store);
    }

    @Test
    void optInCreatesUnseenPlayer() {
        service.setEligible("Ann", true);

        assertThat(queries.playerCard("Ann")).hasValueSatisfying(card -> {
            assertThat(card.eligible()).isTrue();
            assertThat(card.xp()).isZero();
            assertThat(card.level()).isEqualTo(1);
            assertThat(card.lastSeen()).isEqualTo(NOW);
        });
    }

    @Test
    void togglesExistingPlayer() {
        service.setEligible("Ann", true);
        service.setEligible("Ann", false);

        assertThat(queries.playerCard("Ann")).hasValueSatisfying(card -> assertThat(card.eligible()).isFalse());
        assertThat(queries.topPlayers(10)).hasSize(1);
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> service.setEligible(" ", true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
