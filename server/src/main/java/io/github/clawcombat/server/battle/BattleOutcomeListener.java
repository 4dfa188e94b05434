package io.github.clawcombat.server.battle;

import io.github.clawcombat.battle.BattleResult;

public interface BattleOutcomeListener {
    void onBattleFinished(BattleResult result);
}
