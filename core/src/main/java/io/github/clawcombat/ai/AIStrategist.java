package io.github.clawcombat.ai;

import com.badlogic.gdx.math.MathUtils;
import com.badlogic.gdx.utils.ObjectMap;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.MoveSlot;
import io.github.clawcombat.battle.TypeChart;
import io.github.clawcombat.data.MoveDatabase;
import io.github.clawcombat.utils.GameLogger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Heuristic move picker for agents nobody is steering. Scores each usable move from a base of 50 and picks by
 * difficulty. Not a search: it never simulates the opponent's reply.
 */
public class AIStrategist {
    public static final int BASE_SCORE = 50;
    public static final int SUPER_EFFECTIVE_BONUS = 30;
    public static final int NOT_VERY_EFFECTIVE_PENALTY = 20;
    public static final int IMMUNE_PENALTY = 40;
    public static final int KNOCKOUT_BONUS = 25;
    public static final int HEAVY_DAMAGE_BONUS = 10;
    public static final int DESPERATION_BONUS = 10;
    public static final int STATUS_BONUS = 15;
    public static final int HEAL_BONUS = 20;
    public static final float DESPERATION_THRESHOLD = 0.25f;
    public static final float HEAL_THRESHOLD = 0.40f;
    public static final float BEST_MOVE_CHANCE = 0.8f;

    private final MoveDatabase moves;
    private final TypeChart typeChart;
    private final Difficulty difficulty;
    private final ObjectMap<ElementType, ObjectMap<ElementType, Float>> effectivenessCache = new ObjectMap<>();

    public AIStrategist(MoveDatabase moves, Difficulty difficulty) {
        this(moves, TypeChart.standard(), difficulty);
    }

    public AIStrategist(MoveDatabase moves, TypeChart typeChart, Difficulty difficulty) {
        this.moves = moves;
        this.typeChart = typeChart;
        this.difficulty = difficulty != null ? difficulty : Difficulty.NORMAL;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    /**
     * Move id to submit for {@code self}. Falls back to the first slot when nothing has PP left, and returns null
     * only for a combatant without moves.
     */
    public String chooseMove(CombatantState self, CombatantState opponent, BattleRandom rng) {
        List<MoveScore> ranked = rankMoves(self, opponent);
        if (ranked.isEmpty()) {
            if (self.getMoves().isEmpty()) {
                GameLogger.error("Agent " + self.getAgentId() + " has no moves to choose from");
                return null;
            }
            return self.getMoves().get(0).getMoveId();
        }
        switch (difficulty) {
            case EASY:
                return ranked.get(rng.nextInt(ranked.size())).getMoveId();
            case NORMAL:
                if (ranked.size() == 1 || rng.chance(BEST_MOVE_CHANCE)) {
                    return ranked.get(0).getMoveId();
                }
                return ranked.get(1).getMoveId();
            case HARD:
            default:
                return ranked.get(0).getMoveId();
        }
    }

    /**
     * Usable moves, best first. Equal scores keep loadout order.
     */
    public List<MoveScore> rankMoves(CombatantState self, CombatantState opponent) {
        List<MoveScore> scores = new ArrayList<>();
        List<MoveSlot> slots = self.getMoves();
        for (int i = 0; i < slots.size(); i++) {
            MoveSlot slot = slots.get(i);
            Move move = moves.getMove(slot.getMoveId());
            if (move == null || !slot.hasPp()) {
                continue;
            }
            scores.add(new MoveScore(move.getId(), i, scoreMove(self, opponent, move)));
        }
        scores.sort(Comparator.comparingInt(MoveScore::getScore).reversed());
        return scores;
    }

    public int scoreMove(CombatantState self, CombatantState opponent, Move move) {
        int score = BASE_SCORE;

        if (move.isDamaging()) {
            float effectiveness = effectiveness(move.getType(), opponent.getType());
            if (effectiveness == 0f) {
                score -= IMMUNE_PENALTY;
            } else {
                if (effectiveness > 1f) {
                    score += SUPER_EFFECTIVE_BONUS;
                } else if (effectiveness < 1f) {
                    score -= NOT_VERY_EFFECTIVE_PENALTY;
                }
                int estimate = estimateDamage(self, opponent, move, effectiveness);
                if (estimate >= opponent.getCurrentHp()) {
                    score += KNOCKOUT_BONUS;
                }
                if (estimate >= opponent.getMaxHp() * 0.5f) {
                    score += HEAVY_DAMAGE_BONUS;
                }
                if (self.hpRatio() < DESPERATION_THRESHOLD) {
                    score += DESPERATION_BONUS;
                }
            }
        }

        MoveEffect effect = move.getEffect();
        if (effect instanceof MoveEffect.InflictStatus) {
            MoveEffect.InflictStatus status = (MoveEffect.InflictStatus) effect;
            boolean targetsOpponent = status.getTarget() == MoveEffect.Target.OPPONENT;
            boolean open = status.getStatus().isPrimary()
                ? !opponent.hasPrimaryStatus()
                : !opponent.hasStatus(status.getStatus());
            if (targetsOpponent && open) {
                score += STATUS_BONUS;
            }
        }
        if (move.hasEffect(MoveEffect.Kind.HEAL) && self.hpRatio() < HEAL_THRESHOLD) {
            score += HEAL_BONUS;
        }

        score -= (100 - move.getAccuracy()) / 5;
        return MathUtils.clamp(score, 0, 100);
    }

    /**
     * Rough damage used only for scoring; no stages, STAB or randomness.
     */
    public int estimateDamage(CombatantState self, CombatantState opponent, Move move, float effectiveness) {
        boolean physical = move.isPhysical();
        int attack = self.getStat(physical ? Stat.ATTACK : Stat.SP_ATK);
        int defense = opponent.getStat(physical ? Stat.DEFENSE : Stat.SP_DEF);
        return Math.max(1, (int) Math.floor(move.getPower() * (float) attack / Math.max(1, defense) * effectiveness * 0.5f));
    }

    public float effectiveness(ElementType attackType, ElementType defenderType) {
        if (attackType == null || defenderType == null) {
            return 1.0f;
        }
        ObjectMap<ElementType, Float> row = effectivenessCache.get(attackType);
        if (row == null) {
            row = new ObjectMap<>();
            effectivenessCache.put(attackType, row);
        }
        Float cached = row.get(defenderType);
        if (cached == null) {
            cached = typeChart.effectiveness(attackType, defenderType);
            row.put(defenderType, cached);
        }
        return cached;
    }

    public int cacheSize() {
        int size = 0;
        for (ObjectMap<ElementType, Float> row : effectivenessCache.values()) {
            size += row.size;
        }
        return size;
    }

    public void clearCache() {
        effectivenessCache.clear();
    }
}
