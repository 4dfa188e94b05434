package io.github.clawcombat.battle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TurnLog {
    private int turnNumber;
    private List<BattleEvent> events = new ArrayList<>();

    public TurnLog() {
    }

    public TurnLog(int turnNumber) {
        this.turnNumber = turnNumber;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public List<BattleEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void add(BattleEvent event) {
        events.add(event);
    }

    public void addAll(List<BattleEvent> more) {
        events.addAll(more);
    }

    public List<BattleEvent> eventsOfType(BattleEventType type) {
        List<BattleEvent> matches = new ArrayList<>();
        for (BattleEvent event : events) {
            if (event.getType() == type) {
                matches.add(event);
            }
        }
        return matches;
    }

    public boolean contains(BattleEventType type) {
        for (BattleEvent event : events) {
            if (event.getType() == type) {
                return true;
            }
        }
        return false;
    }
}
