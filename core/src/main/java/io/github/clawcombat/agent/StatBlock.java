package io.github.clawcombat.agent;

/**
 * Six values, one per {@link Stat}. Used for base stats, EV spreads and computed battle stats.
 */
public class StatBlock {
    private int hp;
    private int attack;
    private int defense;
    private int spAtk;
    private int spDef;
    private int speed;

    public StatBlock() {
    }

    public StatBlock(int hp, int attack, int defense, int spAtk, int spDef, int speed) {
        this.hp = hp;
        this.attack = attack;
        this.defense = defense;
        this.spAtk = spAtk;
        this.spDef = spDef;
        this.speed = speed;
    }

    public StatBlock(StatBlock other) {
        this(other.hp, other.attack, other.defense, other.spAtk, other.spDef, other.speed);
    }

    public int get(Stat stat) {
        switch (stat) {
            case HP:
                return hp;
            case ATTACK:
                return attack;
            case DEFENSE:
                return defense;
            case SP_ATK:
                return spAtk;
            case SP_DEF:
                return spDef;
            case SPEED:
                return speed;
            default:
                throw new IllegalArgumentException("Unknown stat: " + stat);
        }
    }

    public void set(Stat stat, int value) {
        switch (stat) {
            case HP:
                hp = value;
                break;
            case ATTACK:
                attack = value;
                break;
            case DEFENSE:
                defense = value;
                break;
            case SP_ATK:
                spAtk = value;
                break;
            case SP_DEF:
                spDef = value;
                break;
            case SPEED:
                speed = value;
                break;
        }
    }

    public int getHp() {
        return hp;
    }

    public int getAttack() {
        return attack;
    }

    public int getDefense() {
        return defense;
    }

    public int getSpAtk() {
        return spAtk;
    }

    public int getSpDef() {
        return spDef;
    }

    public int getSpeed() {
        return speed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatBlock)) return false;
        StatBlock that = (StatBlock) o;
        return hp == that.hp && attack == that.attack && defense == that.defense
            && spAtk == that.spAtk && spDef == that.spDef && speed == that.speed;
    }

    @Override
    public int hashCode() {
        int result = hp;
        result = 31 * result + attack;
        result = 31 * result + defense;
        result = 31 * result + spAtk;
        result = 31 * result + spDef;
        result = 31 * result + speed;
        return result;
    }

    @Override
    public String toString() {
        return "StatBlock{hp=" + hp + ", attack=" + attack + ", defense=" + defense +
            ", spAtk=" + spAtk + ", spDef=" + spDef + ", speed=" + speed + '}';
    }
}
