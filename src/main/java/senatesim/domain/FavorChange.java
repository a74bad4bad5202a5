package senatesim.domain;

/** A staged change to one favor debt: positive credits the debt, negative pays it down. */
public record FavorChange(String debtorId, String benefactorId, double delta) {
}
