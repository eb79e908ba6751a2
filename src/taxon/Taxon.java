package taxon;

/**
 * A leaf of the tree sequence. The id is the leaf's position in the
 * canonical leaf order and is shared by every tree of the sequence.
 */
public class Taxon {

    public final int id;
    public final String label;

    public Taxon(int id, String label) {
        this.id = id;
        this.label = label;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Taxon)) return false;
        Taxon other = (Taxon) obj;
        return id == other.id && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return 31 * id + label.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
