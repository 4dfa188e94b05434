package io.github.clawcombat.battle;

import io.github.clawcombat.agent.AgentProfile;
import io.github.clawcombat.agent.ElementType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.clawcombat.battle.BattleFixtures.MOVES;
import static io.github.clawcombat.battle.BattleFixtures.agent;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BattleStateBuilderTest {
    private final BattleStateBuilder builder = new BattleStateBuilder(MOVES);

    private static List<String> moveIds(CombatantState combatant) {
        List<String> ids = new ArrayList<>();
        for (MoveSlot slot : combatant.getMoves()) {
            ids.add(slot.getMoveId());
        }
        return ids;
    }

    @Test
    void freshStateStartsWaitingAtFullHp() {
        BattleState state = builder.build("b1", agent("alpha", ElementType.FIRE, 10).build(),
            agent("beta", ElementType.WATER, 12).build(), 5_000L);

        assertEquals("b1", state.getBattleId());
        assertEquals(0, state.getTurnNumber());
        assertEquals(BattleStatus.ACTIVE, state.getStatus());
        assertEquals(BattlePhase.WAITING, state.getCurrentPhase());
        assertEquals(5_000L, state.getCreatedAt());
        assertNull(state.getWinnerId());
        for (Side side : Side.values()) {
            CombatantState combatant = state.get(side);
            assertEquals(combatant.getMaxHp(), combatant.getCurrentHp());
            assertNull(combatant.getStatus());
            assertFalse(combatant.isConfused());
            assertEquals(0, combatant.getStage(io.github.clawcombat.agent.Stat.ATTACK));
        }
    }

    @Test
    void emptyMoveListGetsTypeLoadout() {
        CombatantState combatant = builder.buildCombatant(agent("alpha", ElementType.FIRE, 10).build());
        assertEquals(List.of("ember", "flame_claw", "scald_mist", "flare_rush"), moveIds(combatant));
        assertEquals(25, combatant.findMove("ember").getCurrentPp());
    }

    @Test
    void unknownMovesAreDroppedAndDuplicatesSkipped() {
        AgentProfile profile = agent("alpha", ElementType.WATER, 10)
            .moves("aqua_claw", "nonexistent", "aqua_claw", "bubble_jet")
            .build();
        assertEquals(List.of("aqua_claw", "bubble_jet"), moveIds(builder.buildCombatant(profile)));
    }

    @Test
    void onlyUnknownMovesFallBackToLoadout() {
        AgentProfile profile = agent("alpha", ElementType.EARTH, 10).moves("nope", "still_nope").build();
        assertEquals(MOVES.getDefaultLoadout(ElementType.EARTH), moveIds(builder.buildCombatant(profile)));
    }

    @Test
    void levelIsClamped() {
        assertEquals(100, builder.buildCombatant(agent("alpha", ElementType.FIRE, 150).build()).getLevel());
        assertEquals(1, builder.buildCombatant(agent("alpha", ElementType.FIRE, 0).build()).getLevel());
    }

    @Test
    void sameProfilesGiveSameStats() {
        AgentProfile profile = agent("alpha", ElementType.ICE, 42).evs(10, 20, 30, 40, 50, 60).build();
        CombatantState first = builder.buildCombatant(profile);
        CombatantState second = builder.buildCombatant(profile);
        assertEquals(first.getStats(), second.getStats());
        assertEquals(moveIds(first), moveIds(second));
    }

    @Test
    void rejectsSelfBattleAndMissingProfiles() {
        AgentProfile alpha = agent("alpha", ElementType.FIRE, 10).build();
        assertThrows(IllegalArgumentException.class, () -> builder.build("b", alpha, alpha, 0L));
        assertThrows(IllegalArgumentException.class, () -> builder.build("b", alpha, null, 0L));
    }
}
