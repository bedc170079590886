package de.icepolcka.catalog.store;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileKind;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.error.StoreException;
import de.icepolcka.catalog.product.RangeMode;
import de.icepolcka.catalog.product.ReferenceData;
import de.icepolcka.catalog.product.ReferenceEntry;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * H2-backed store. One embedded database file per product, accessed through plain JDBC.
 *
 * <p>The database lives at {@code <storePath>.mv.db}. Reads use auto-commit connections from a
 * small pool and only ever observe committed state.
 */
public class H2CatalogStore implements CatalogStore {

    private static final Logger LOG = Logger.getLogger(H2CatalogStore.class);

    static final String H2_SUFFIX = ".mv.db";
    private static final String PRODUCT_KEY = "product";
    private static final int ROLE_BATCH = 500;

    // Widest instants a TIMESTAMP WITH TIME ZONE column holds; query bounds are clamped to these.
    static final Instant EARLIEST_STORABLE = LocalDateTime.MIN.toInstant(ZoneOffset.UTC);
    static final Instant LATEST_STORABLE = LocalDateTime.MAX.toInstant(ZoneOffset.UTC);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS catalog_meta (
                meta_key VARCHAR(64) PRIMARY KEY,
                meta_value VARCHAR(1024) NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS reference_entry (
                category VARCHAR(32) NOT NULL,
                name VARCHAR(255) NOT NULL,
                code INT,
                PRIMARY KEY (category, name)
            )""",
            """
            CREATE TABLE IF NOT EXISTS data_file (
                path VARCHAR(4096) PRIMARY KEY,
                kind VARCHAR(64) NOT NULL,
                modified_at TIMESTAMP(9) WITH TIME ZONE,
                last_checked TIMESTAMP(9) WITH TIME ZONE NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS dataset (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                identity_digest CHAR(64) NOT NULL,
                identity_key VARCHAR(4096) NOT NULL,
                start_time TIMESTAMP(9) WITH TIME ZONE NOT NULL,
                end_time TIMESTAMP(9) WITH TIME ZONE,
                parameter_id INT,
                source VARCHAR(255),
                radar VARCHAR(255),
                domain VARCHAR(255),
                method VARCHAR(255),
                hydrometeor VARCHAR(255),
                model VARCHAR(255)
            )""",
            "CREATE INDEX IF NOT EXISTS dataset_identity_idx ON dataset (identity_digest)",
            "CREATE INDEX IF NOT EXISTS dataset_time_idx ON dataset (start_time, id)",
            """
            CREATE TABLE IF NOT EXISTS dataset_role (
                dataset_id BIGINT NOT NULL,
                role VARCHAR(64) NOT NULL,
                path VARCHAR(4096) NOT NULL,
                PRIMARY KEY (dataset_id, role),
                FOREIGN KEY (dataset_id) REFERENCES dataset (id),
                FOREIGN KEY (path) REFERENCES data_file (path)
            )""",
            "CREATE INDEX IF NOT EXISTS dataset_role_path_idx ON dataset_role (path)"
    );

    private static final Map<Attribute, String> COLUMNS = new EnumMap<>(Attribute.class);

    static {
        COLUMNS.put(Attribute.TIME, "start_time");
        COLUMNS.put(Attribute.END_TIME, "end_time");
        COLUMNS.put(Attribute.PARAMETER_ID, "parameter_id");
        COLUMNS.put(Attribute.SOURCE, "source");
        COLUMNS.put(Attribute.RADAR, "radar");
        COLUMNS.put(Attribute.DOMAIN, "domain");
        COLUMNS.put(Attribute.METHOD, "method");
        COLUMNS.put(Attribute.HYDROMETEOR, "hydrometeor");
        COLUMNS.put(Attribute.MODEL, "model");
    }

    private final JdbcConnectionPool pool;
    private final String productName;
    private final ReferenceData referenceData;

    private H2CatalogStore(JdbcConnectionPool pool, String productName, ReferenceData referenceData) {
        this.pool = pool;
        this.productName = productName;
        this.referenceData = referenceData;
    }

    /**
     * Open the store at {@code storePath}, creating it and seeding {@code referenceData} if it does not
     * exist yet. Reference entries missing from an existing store are added.
     */
    public static H2CatalogStore open(Path storePath, String productName, ReferenceData referenceData)
            throws CatalogOpenException {
        Path base = databaseBase(storePath);
        boolean exists = Files.exists(Path.of(base + H2_SUFFIX));

        try {
            Path parent = base.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new CatalogOpenException("Cannot create store directory for " + storePath, e);
        }

        JdbcConnectionPool pool = JdbcConnectionPool.create("jdbc:h2:file:" + base, "sa", "");
        try (Connection conn = pool.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    for (String ddl : SCHEMA) {
                        stmt.execute(ddl);
                    }
                }
                claimProduct(conn, productName, storePath);
                ReferenceData stored = readReferenceData(conn);
                List<ReferenceEntry> missing = stored.missingFrom(referenceData);
                insertReferenceEntries(conn, missing);
                conn.commit();

                if (!exists) {
                    LOG.infof("Created store for %s at %s (%d reference entries)",
                            productName, storePath, missing.size());
                } else if (!missing.isEmpty()) {
                    LOG.infof("Added %d reference entries to store %s", missing.size(), storePath);
                }
                return new H2CatalogStore(pool, productName, readReferenceData(conn));
            } catch (SQLException | CatalogOpenException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            pool.dispose();
            throw new CatalogOpenException("Cannot open store " + storePath + ": " + e.getMessage(), e);
        } catch (CatalogOpenException e) {
            pool.dispose();
            throw e;
        }
    }

    static Path databaseBase(Path storePath) {
        Path absolute = storePath.toAbsolutePath().normalize();
        String name = absolute.toString();
        return name.endsWith(H2_SUFFIX)
                ? Path.of(name.substring(0, name.length() - H2_SUFFIX.length()))
                : absolute;
    }

    private static void claimProduct(Connection conn, String productName, Path storePath)
            throws SQLException, CatalogOpenException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT meta_value FROM catalog_meta WHERE meta_key = ?")) {
            ps.setString(1, PRODUCT_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String owner = rs.getString(1);
                    if (!owner.equals(productName)) {
                        throw new CatalogOpenException("Store " + storePath + " belongs to product " + owner
                                + ", not " + productName);
                    }
                    return;
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO catalog_meta (meta_key, meta_value) VALUES (?, ?)")) {
            ps.setString(1, PRODUCT_KEY);
            ps.setString(2, productName);
            ps.executeUpdate();
        }
    }

    private static ReferenceData readReferenceData(Connection conn) throws SQLException {
        List<ReferenceEntry> entries = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT category, name, code FROM reference_entry ORDER BY category, code, name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(new ReferenceEntry(
                        Attribute.valueOf(rs.getString("category")),
                        rs.getString("name"),
                        rs.getObject("code", Integer.class)));
            }
        }
        return new ReferenceData(entries);
    }

    private static void insertReferenceEntries(Connection conn, List<ReferenceEntry> entries) throws SQLException {
        if (entries.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "MERGE INTO reference_entry (category, name, code) KEY (category, name) VALUES (?, ?, ?)")) {
            for (ReferenceEntry entry : entries) {
                ps.setString(1, entry.category().name());
                ps.setString(2, entry.name());
                if (entry.code() != null) {
                    ps.setInt(3, entry.code());
                } else {
                    ps.setNull(3, Types.INTEGER);
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public String productName() {
        return productName;
    }

    @Override
    public ReferenceData referenceData() {
        return referenceData;
    }

    @Override
    public StoreTransaction begin() {
        try {
            Connection conn = pool.getConnection();
            conn.setAutoCommit(false);
            return new H2Transaction(conn);
        } catch (SQLException e) {
            throw new StoreException("Cannot start transaction on " + productName + " store", e);
        }
    }

    @Override
    public Optional<FileRecord> findFile(String path) {
        try (Connection conn = pool.getConnection()) {
            return findFile(conn, path);
        } catch (SQLException e) {
            throw new StoreException("Failed to read file record " + path, e);
        }
    }

    @Override
    public List<FileRecord> files() {
        try (Connection conn = pool.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT path, kind, modified_at, last_checked FROM data_file ORDER BY path");
             ResultSet rs = ps.executeQuery()) {
            List<FileRecord> files = new ArrayList<>();
            while (rs.next()) {
                files.add(toFileRecord(rs));
            }
            return files;
        } catch (SQLException e) {
            throw new StoreException("Failed to list file records", e);
        }
    }

    @Override
    public List<DatasetRecord> datasets() {
        return queryDatasets(new SqlQuery("", List.of()), "ORDER BY id", null);
    }

    @Override
    public List<DatasetRecord> range(Instant start, Instant end, RangeMode mode, QueryFilter filter) {
        SqlQuery where = SqlQuery.filter(filter)
                .and("start_time >= ?", clamp(start))
                .and("start_time <= ?", clamp(end));
        if (mode == RangeMode.CONTAINED) {
            where = where.and("COALESCE(end_time, start_time) <= ?", clamp(end));
        }
        return queryDatasets(where, "ORDER BY start_time ASC, id ASC", null);
    }

    @Override
    public Optional<DatasetRecord> latestAtOrBefore(Instant time, QueryFilter filter) {
        SqlQuery where = SqlQuery.filter(filter).and("start_time <= ?", clamp(time));
        return queryDatasets(where, "ORDER BY start_time DESC, id DESC", 1).stream().findFirst();
    }

    @Override
    public Optional<DatasetRecord> earliestAfter(Instant time, QueryFilter filter) {
        SqlQuery where = SqlQuery.filter(filter).and("start_time > ?", clamp(time));
        return queryDatasets(where, "ORDER BY start_time ASC, id ASC", 1).stream().findFirst();
    }

    @Override
    public List<DatasetRecord> latest(int limit, QueryFilter filter) {
        return queryDatasets(SqlQuery.filter(filter), "ORDER BY start_time DESC, id DESC", limit);
    }

    @Override
    public void close() {
        pool.dispose();
        LOG.debugf("Closed store for %s", productName);
    }

    private List<DatasetRecord> queryDatasets(SqlQuery where, String orderBy, Integer limit) {
        try (Connection conn = pool.getConnection()) {
            return queryDatasets(conn, where, orderBy, limit);
        } catch (SQLException e) {
            throw new StoreException("Failed to query datasets of " + productName, e);
        }
    }

    private static List<DatasetRecord> queryDatasets(Connection conn, SqlQuery where, String orderBy, Integer limit)
            throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT * FROM dataset");
        if (!where.clause().isEmpty()) {
            sql.append(" WHERE ").append(where.clause());
        }
        sql.append(' ').append(orderBy);
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }

        Map<Long, DatasetRecord> rows = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            where.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    DatasetRecord record = toDatasetRecord(rs);
                    rows.put(record.id(), record);
                }
            }
        }
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, Map<String, String>> roles = loadRoles(conn, new ArrayList<>(rows.keySet()));
        List<DatasetRecord> result = new ArrayList<>(rows.size());
        for (DatasetRecord record : rows.values()) {
            result.add(new DatasetRecord(record.id(), record.identityKey(),
                    roles.getOrDefault(record.id(), Map.of()), record.attributes()));
        }
        return result;
    }

    private static Map<Long, Map<String, String>> loadRoles(Connection conn, List<Long> ids) throws SQLException {
        Map<Long, Map<String, String>> roles = new TreeMap<>();
        for (int from = 0; from < ids.size(); from += ROLE_BATCH) {
            List<Long> batch = ids.subList(from, Math.min(ids.size(), from + ROLE_BATCH));
            String placeholders = String.join(", ", Collections.nCopies(batch.size(), "?"));
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT dataset_id, role, path FROM dataset_role WHERE dataset_id IN (" + placeholders + ")")) {
                for (int i = 0; i < batch.size(); i++) {
                    ps.setLong(i + 1, batch.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        roles.computeIfAbsent(rs.getLong("dataset_id"), id -> new TreeMap<>())
                                .put(rs.getString("role"), rs.getString("path"));
                    }
                }
            }
        }
        return roles;
    }

    private static Optional<FileRecord> findFile(Connection conn, String path) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT path, kind, modified_at, last_checked FROM data_file WHERE path = ?")) {
            ps.setString(1, path);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toFileRecord(rs)) : Optional.empty();
            }
        }
    }

    private static FileRecord toFileRecord(ResultSet rs) throws SQLException {
        return new FileRecord(
                rs.getString("path"),
                new FileKind(rs.getString("kind")),
                readInstant(rs, "modified_at"),
                readInstant(rs, "last_checked")
        );
    }

    private static DatasetRecord toDatasetRecord(ResultSet rs) throws SQLException {
        int parameterId = rs.getInt("parameter_id");
        Integer parameter = rs.wasNull() ? null : parameterId;
        DatasetAttributes attributes = DatasetAttributes.at(readInstant(rs, "start_time"))
                .endTime(readInstant(rs, "end_time"))
                .parameterId(parameter)
                .source(rs.getString("source"))
                .radar(rs.getString("radar"))
                .domain(rs.getString("domain"))
                .method(rs.getString("method"))
                .hydrometeor(rs.getString("hydrometeor"))
                .model(rs.getString("model"))
                .build();
        return new DatasetRecord(rs.getLong("id"), new IdentityKey(rs.getString("identity_key")), Map.of(),
                attributes);
    }

    static Instant clamp(Instant instant) {
        if (instant.isBefore(EARLIEST_STORABLE)) {
            return EARLIEST_STORABLE;
        }
        return instant.isAfter(LATEST_STORABLE) ? LATEST_STORABLE : instant;
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else if (value instanceof Instant instant) {
            ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        } else if (value instanceof Integer number) {
            ps.setInt(index, number);
        } else {
            ps.setString(index, value.toString());
        }
    }

    private static void bindInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    private static void bindInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    /**
     * WHERE clause with its positional parameters.
     */
    private record SqlQuery(String clause, List<Object> params) {

        static SqlQuery filter(QueryFilter filter) {
            SqlQuery query = new SqlQuery("", List.of());
            for (Attribute attribute : filter.constrained()) {
                query = query.and(COLUMNS.get(attribute) + " = ?", filter.valueOf(attribute));
            }
            return query;
        }

        SqlQuery and(String condition, Object param) {
            List<Object> extended = new ArrayList<>(params);
            extended.add(param);
            return new SqlQuery(clause.isEmpty() ? condition : clause + " AND " + condition, extended);
        }

        void bind(PreparedStatement ps) throws SQLException {
            for (int i = 0; i < params.size(); i++) {
                bindValue(ps, i + 1, params.get(i));
            }
        }
    }

    private final class H2Transaction implements StoreTransaction {

        private final Connection conn;
        private boolean done;

        private H2Transaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<FileRecord> findFile(String path) {
            try {
                return H2CatalogStore.findFile(conn, path);
            } catch (SQLException e) {
                throw new StoreException("Failed to read file record " + path, e);
            }
        }

        @Override
        public void upsertFile(FileRecord record) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "MERGE INTO data_file (path, kind, modified_at, last_checked) KEY (path) VALUES (?, ?, ?, ?)")) {
                ps.setString(1, record.path());
                ps.setString(2, record.kind().name());
                bindInstant(ps, 3, record.modifiedAt());
                bindInstant(ps, 4, record.lastChecked());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Failed to upsert file record " + record.path(), e);
            }
        }

        @Override
        public List<DatasetRecord> findByIdentity(IdentityKey identityKey) {
            SqlQuery where = new SqlQuery("identity_digest = ?", List.of(identityKey.digest()))
                    .and("identity_key = ?", identityKey.canonical());
            try {
                return queryDatasets(conn, where, "ORDER BY id", null);
            } catch (SQLException e) {
                throw new StoreException("Failed to look up datasets for " + identityKey, e);
            }
        }

        @Override
        public List<DatasetRecord> findByPath(String path) {
            SqlQuery where = new SqlQuery("id IN (SELECT dataset_id FROM dataset_role WHERE path = ?)", List.of(path));
            try {
                return queryDatasets(conn, where, "ORDER BY id", null);
            } catch (SQLException e) {
                throw new StoreException("Failed to look up datasets referencing " + path, e);
            }
        }

        @Override
        public DatasetRecord insertDataset(DatasetRecord record) {
            String sql = "INSERT INTO dataset (identity_digest, identity_key, start_time, end_time, parameter_id, "
                    + "source, radar, domain, method, hydrometeor, model) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, record.identityKey().digest());
                ps.setString(2, record.identityKey().canonical());
                bindAttributes(ps, 3, record.attributes());
                ps.executeUpdate();
                long id;
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for dataset " + record.identityKey());
                    }
                    id = keys.getLong(1);
                }
                DatasetRecord saved = record.withId(id);
                writeRoles(saved);
                return saved;
            } catch (SQLException e) {
                throw new StoreException("Failed to insert dataset " + record.identityKey(), e);
            }
        }

        @Override
        public void updateDataset(DatasetRecord record) {
            String sql = "UPDATE dataset SET start_time = ?, end_time = ?, parameter_id = ?, source = ?, radar = ?, "
                    + "domain = ?, method = ?, hydrometeor = ?, model = ? WHERE id = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bindAttributes(ps, 1, record.attributes());
                ps.setLong(10, record.id());
                if (ps.executeUpdate() != 1) {
                    throw new IllegalArgumentException("Dataset not found: " + record.id());
                }
                try (PreparedStatement delete = conn.prepareStatement(
                        "DELETE FROM dataset_role WHERE dataset_id = ?")) {
                    delete.setLong(1, record.id());
                    delete.executeUpdate();
                }
                writeRoles(record);
            } catch (SQLException e) {
                throw new StoreException("Failed to update dataset " + record.id(), e);
            }
        }

        @Override
        public void commit() {
            if (done) {
                throw new IllegalStateException("Transaction already finished");
            }
            try {
                conn.commit();
                done = true;
            } catch (SQLException e) {
                throw new StoreException("Failed to commit " + productName + " store", e);
            }
        }

        @Override
        public void close() {
            try {
                if (!done) {
                    LOG.debugf("Rolling back uncommitted changes for %s", productName);
                    conn.rollback();
                    done = true;
                }
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                throw new StoreException("Failed to roll back " + productName + " store", e);
            } finally {
                closeQuietly();
            }
        }

        private void closeQuietly() {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.warnf(e, "Failed to release connection of %s store", productName);
            }
        }

        private void bindAttributes(PreparedStatement ps, int first, DatasetAttributes attributes)
                throws SQLException {
            bindInstant(ps, first, attributes.time());
            bindInstant(ps, first + 1, attributes.endTime());
            bindInteger(ps, first + 2, attributes.parameterId());
            ps.setString(first + 3, attributes.source());
            ps.setString(first + 4, attributes.radar());
            ps.setString(first + 5, attributes.domain());
            ps.setString(first + 6, attributes.method());
            ps.setString(first + 7, attributes.hydrometeor());
            ps.setString(first + 8, attributes.model());
        }

        private void writeRoles(DatasetRecord record) throws SQLException {
            if (record.roles().isEmpty()) {
                return;
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO dataset_role (dataset_id, role, path) VALUES (?, ?, ?)")) {
                for (Map.Entry<String, String> role : record.roles().entrySet()) {
                    ps.setLong(1, record.id());
                    ps.setString(2, role.getKey());
                    ps.setString(3, role.getValue());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }
    }
}
