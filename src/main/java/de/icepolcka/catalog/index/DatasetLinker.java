package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;
import de.icepolcka.catalog.error.DuplicateDatasetException;
import de.icepolcka.catalog.store.StoreTransaction;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Resolves which dataset a parsed file belongs to and attaches it there.
 * Keeps at most one dataset per identity key.
 */
final class DatasetLinker {

    private static final Logger LOG = Logger.getLogger(DatasetLinker.class);

    /**
     * Attach {@code file} under {@code role} to the dataset for {@code identityKey}, creating it if needed.
     * Writes go to {@code tx} and are committed together with the file record.
     */
    DatasetRecord attach(StoreTransaction tx, IdentityKey identityKey, String role, FileRecord file,
                         DatasetAttributes attributes) throws DuplicateDatasetException {
        List<DatasetRecord> existing = tx.findByIdentity(identityKey);

        if (existing.isEmpty()) {
            DatasetRecord created = tx.insertDataset(
                    DatasetRecord.create(identityKey, role, file.path(), attributes));
            LOG.debugf("Created dataset %d for %s (%s: %s)", created.id(), identityKey, role, file.path());
            return created;
        }
        if (existing.size() > 1) {
            throw new DuplicateDatasetException(identityKey, existing.size());
        }

        DatasetRecord current = existing.get(0);
        current.pathFor(role)
                .filter(previous -> !previous.equals(file.path()))
                .ifPresent(previous -> LOG.infof("Dataset %d: role %s moves from %s to %s",
                        current.id(), role, previous, file.path()));

        DatasetRecord updated = current
                .withRole(role, file.path())
                .withAttributes(attributes);
        tx.updateDataset(updated);
        LOG.debugf("Attached %s as %s to dataset %d", file.path(), role, updated.id());
        return updated;
    }

    /**
     * Detach {@code path} from every dataset other than the one for {@code keep}.
     * Used when a re-parsed file now maps to a different identity, or no longer parses at all
     * ({@code keep} null). The datasets themselves are kept.
     */
    void release(StoreTransaction tx, String path, IdentityKey keep) {
        for (DatasetRecord dataset : tx.findByPath(path)) {
            if (dataset.identityKey().equals(keep)) {
                continue;
            }
            tx.updateDataset(dataset.withoutPath(path));
            LOG.infof("Released %s from dataset %d (%s)", path, dataset.id(), dataset.identityKey());
        }
    }
}
