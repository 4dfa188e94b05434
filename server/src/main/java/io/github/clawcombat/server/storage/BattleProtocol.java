package io.github.clawcombat.server.storage;

import com.esotericsoftware.kryo.Kryo;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.StatBlock;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.BattlePhase;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStatus;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.EndReason;
import io.github.clawcombat.battle.MoveSlot;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.StatStages;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.status.StatusCondition;

import java.util.ArrayList;

public class BattleProtocol {
    private BattleProtocol() {
    }

    /** Registration order is part of the binary format; append new classes at the end. */
    public static void registerClasses(Kryo kryo) {
        kryo.register(ArrayList.class);

        // Enums
        kryo.register(ElementType.class);
        kryo.register(Stat.class);
        kryo.register(StatusCondition.class);
        kryo.register(Side.class);
        kryo.register(BattleStatus.class);
        kryo.register(BattlePhase.class);
        kryo.register(EndReason.class);
        kryo.register(BattleEventType.class);

        // State
        kryo.register(StatBlock.class);
        kryo.register(StatStages.class);
        kryo.register(MoveSlot.class);
        kryo.register(CombatantState.class);
        kryo.register(BattleEvent.class);
        kryo.register(TurnLog.class);
        kryo.register(BattleState.class);
    }
}
