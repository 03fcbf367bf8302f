package com.nistpubid.core.grammar;

/**
 * Qualifier wording of the two descriptive styles.
 *
 * <p>Each clause constant includes its leading separator: volume and revision are introduced by
 * a comma, the other clauses by a space only. Clauses appear in this order after the document
 * number: volume, part, version, revision or edition, update.
 */
public enum Vocabulary {

    LONG("Addendum", ", Volume ", " Part ", " Version ", ", Revision ", " Edition ", " Update "),

    ABBREV("Add.", ", Vol. ", " Pt. ", " Ver. ", ", Rev. ", " Ed. ", " Upd. ");

    private final String addendum;
    private final String volumeClause;
    private final String partClause;
    private final String versionClause;
    private final String revisionClause;
    private final String editionClause;
    private final String updateClause;

    Vocabulary(String addendum, String volumeClause, String partClause, String versionClause,
               String revisionClause, String editionClause, String updateClause) {
        this.addendum = addendum;
        this.volumeClause = volumeClause;
        this.partClause = partClause;
        this.versionClause = versionClause;
        this.revisionClause = revisionClause;
        this.editionClause = editionClause;
        this.updateClause = updateClause;
    }

    /**
     * Returns the word that opens an addendum prefix, as in {@code Addendum to ...}.
     *
     * @return addendum word
     */
    public String addendum() {
        return addendum;
    }

    public String volumeClause() {
        return volumeClause;
    }

    public String partClause() {
        return partClause;
    }

    public String versionClause() {
        return versionClause;
    }

    public String revisionClause() {
        return revisionClause;
    }

    public String editionClause() {
        return editionClause;
    }

    public String updateClause() {
        return updateClause;
    }

    /**
     * Builds the prefix placed before the whole identifier of an addendum.
     *
     * @param number addendum sequence number; 1 is implied and not written
     * @return prefix including the trailing space, e.g. {@code Addendum to }
     */
    public String addendumPrefix(int number) {
        return number == 1 ? addendum + " to " : addendum + " " + number + " to ";
    }
}
