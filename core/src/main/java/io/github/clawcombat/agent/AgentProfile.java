package io.github.clawcombat.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored agent record as handed to the battle core. Read-only once built.
 */
public class AgentProfile {
    public static final int MAX_MOVES = 4;

    private final String id;
    private final String name;
    private final ElementType type;
    private final int level;
    private final StatBlock baseStats;
    private final StatBlock evs;
    private final Stat natureBoost;
    private final Stat natureReduce;
    private final String ability;
    private final List<String> moveIds;
    private final boolean externallyControlled;

    private AgentProfile(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = builder.type != null ? builder.type : ElementType.NEUTRAL;
        this.level = builder.level;
        this.baseStats = builder.baseStats;
        this.evs = builder.evs;
        this.natureBoost = builder.natureBoost;
        this.natureReduce = builder.natureReduce;
        this.ability = builder.ability;
        this.moveIds = Collections.unmodifiableList(new ArrayList<>(builder.moveIds));
        this.externallyControlled = builder.externallyControlled;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ElementType getType() {
        return type;
    }

    public int getLevel() {
        return level;
    }

    /** May be null, in which case default base stats apply. */
    public StatBlock getBaseStats() {
        return baseStats;
    }

    /** May be null, meaning no EV investment. */
    public StatBlock getEvs() {
        return evs;
    }

    public Stat getNatureBoost() {
        return natureBoost;
    }

    public Stat getNatureReduce() {
        return natureReduce;
    }

    public String getAbility() {
        return ability;
    }

    public List<String> getMoveIds() {
        return moveIds;
    }

    /**
     * True when a bot hosted elsewhere submits this agent's moves; otherwise the strategist plays for it.
     */
    public boolean isExternallyControlled() {
        return externallyControlled;
    }

    public static class Builder {
        private final String id;
        private String name;
        private ElementType type;
        private int level = 1;
        private StatBlock baseStats;
        private StatBlock evs;
        private Stat natureBoost;
        private Stat natureReduce;
        private String ability;
        private final List<String> moveIds = new ArrayList<>();
        private boolean externallyControlled;

        public Builder(String id) {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("Agent id cannot be empty");
            }
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ElementType type) {
            this.type = type;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder baseStats(int hp, int attack, int defense, int spAtk, int spDef, int speed) {
            this.baseStats = new StatBlock(hp, attack, defense, spAtk, spDef, speed);
            return this;
        }

        public Builder baseStats(StatBlock baseStats) {
            this.baseStats = baseStats != null ? new StatBlock(baseStats) : null;
            return this;
        }

        public Builder evs(int hp, int attack, int defense, int spAtk, int spDef, int speed) {
            this.evs = new StatBlock(hp, attack, defense, spAtk, spDef, speed);
            return this;
        }

        public Builder evs(StatBlock evs) {
            this.evs = evs != null ? new StatBlock(evs) : null;
            return this;
        }

        public Builder nature(Stat boost, Stat reduce) {
            this.natureBoost = boost;
            this.natureReduce = reduce;
            return this;
        }

        public Builder nature(Nature nature) {
            if (nature != null) {
                this.natureBoost = nature.getBoosted();
                this.natureReduce = nature.getReduced();
            }
            return this;
        }

        public Builder ability(String ability) {
            this.ability = ability;
            return this;
        }

        public Builder moves(List<String> moveIds) {
            this.moveIds.clear();
            if (moveIds != null) {
                for (String moveId : moveIds) {
                    if (moveId != null && this.moveIds.size() < MAX_MOVES) {
                        this.moveIds.add(moveId);
                    }
                }
            }
            return this;
        }

        public Builder moves(String... moveIds) {
            List<String> list = new ArrayList<>();
            Collections.addAll(list, moveIds);
            return moves(list);
        }

        public Builder externallyControlled(boolean externallyControlled) {
            this.externallyControlled = externallyControlled;
            return this;
        }

        public AgentProfile build() {
            return new AgentProfile(this);
        }
    }
}
