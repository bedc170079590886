package de.icepolcka.catalog.store;

import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;

import java.util.List;
import java.util.Optional;

/**
 * Write transaction. Reads made through it see its own uncommitted writes.
 * Closing a transaction that was not committed discards all of its writes.
 */
public interface StoreTransaction extends AutoCloseable {

    Optional<FileRecord> findFile(String path);

    /**
     * Insert or replace the record for {@code record.path()}.
     */
    void upsertFile(FileRecord record);

    List<DatasetRecord> findByIdentity(IdentityKey identityKey);

    /**
     * Datasets that have {@code path} attached under any role.
     */
    List<DatasetRecord> findByPath(String path);

    /**
     * Insert a new dataset and return it with its store-assigned id.
     */
    DatasetRecord insertDataset(DatasetRecord record);

    void updateDataset(DatasetRecord record);

    void commit();

    @Override
    void close();
}
