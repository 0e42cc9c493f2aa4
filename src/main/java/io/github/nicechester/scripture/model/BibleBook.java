package io.github.nicechester.scripture.model;

/**
 * One canonical book as listed in the catalog.
 *
 * @param id           stable machine id (e.g. "1-samuel")
 * @param name         display name (e.g. "1 Samuel")
 * @param testament    OT or NT
 * @param chapters     canonical chapter count
 * @param abbreviation short form (e.g. "1 Sam")
 * @param category     collection the book belongs to (Law, Gospel, ...)
 */
public record BibleBook(
    String id,
    String name,
    Testament testament,
    int chapters,
    String abbreviation,
    String category
) {
    public enum Testament {
        /** Old Testament */
        OT,
        /** New Testament */
        NT
    }

    public boolean isOldTestament() {
        return testament == Testament.OT;
    }
}
