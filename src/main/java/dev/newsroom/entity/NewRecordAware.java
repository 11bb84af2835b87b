package dev.newsroom.entity;

/**
 * Entities with application-assigned IDs that tell Spring Data whether the next save is an
 * INSERT or an UPDATE through a {@code newRecord} flag. The flag is cleared by
 * {@link dev.newsroom.config.PersistableEntityCallback} once a row exists.
 */
public interface NewRecordAware {

    boolean isNew();

    void setNewRecord(boolean newRecord);
}
