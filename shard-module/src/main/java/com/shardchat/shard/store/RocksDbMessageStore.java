package com.shardchat.shard.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;
import com.shardchat.common.serialization.ChatJson;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * RocksDB backed {@link MessageStore}.
 * <p>
 * Messages are kept by id in one column family and indexed by creation time in another
 * (8-byte big-endian epoch millis followed by the id), so time ordered scans are plain iterator walks.
 */
@Slf4j
public class RocksDbMessageStore implements MessageStore, AutoCloseable {
    private static final String MESSAGES_CF = "messages";
    private static final String MESSAGES_BY_TIME_CF = "messages_by_time";  // millis + id -> id
    private static final String USERS_CF = "users";

    private final Path dataPath;
    private final String name;
    private final ObjectMapper objectMapper = ChatJson.mapper();
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();

    private DBOptions dbOptions;
    private WriteOptions writeOptions;
    private volatile RocksDB rocksDB;

    public RocksDbMessageStore(Path dataPath, String name) {
        this.dataPath = dataPath;
        this.name = name;
    }

    public void open() {
        RocksDB.loadLibrary();

        try {
            Files.createDirectories(dataPath);

            List<ColumnFamilyDescriptor> columnFamilyDescriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(MESSAGES_CF.getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor(MESSAGES_BY_TIME_CF.getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor(USERS_CF.getBytes(StandardCharsets.UTF_8))
            );

            List<ColumnFamilyHandle> handles = new ArrayList<>();

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
            // a write is acknowledged only once it hit the WAL on disk
            writeOptions = new WriteOptions().setSync(true);

            rocksDB = RocksDB.open(dbOptions, dataPath.toString(), columnFamilyDescriptors, handles);

            columnFamilyHandles.put("default", handles.get(0));
            columnFamilyHandles.put(MESSAGES_CF, handles.get(1));
            columnFamilyHandles.put(MESSAGES_BY_TIME_CF, handles.get(2));
            columnFamilyHandles.put(USERS_CF, handles.get(3));

            log.info("RocksDB message store '{}' opened at path: {}", name, dataPath);
        } catch (RocksDBException | IOException e) {
            log.error("Failed to open RocksDB message store '{}' at {}", name, dataPath, e);
            throw new MessageStoreException("Failed to open message store at " + dataPath, e);
        }
    }

    @Override
    public void insert(ChatMessage message) {
        byte[] idKey = idKey(message.id());
        try (WriteBatch batch = new WriteBatch()) {
            if (db().get(handle(MESSAGES_CF), idKey) != null) {
                throw new MessageStoreException("Message " + message.id() + " already exists");
            }
            batch.put(handle(MESSAGES_CF), idKey, objectMapper.writeValueAsBytes(message));
            batch.put(handle(MESSAGES_BY_TIME_CF), timeKey(message), idKey);
            db().write(writeOptions, batch);
        } catch (RocksDBException | JsonProcessingException e) {
            throw new MessageStoreException("Failed to store message " + message.id(), e);
        }
    }

    @Override
    public Optional<ChatMessage> findById(String id) {
        try {
            return Optional.ofNullable(db().get(handle(MESSAGES_CF), idKey(id))).map(this::readMessage);
        } catch (RocksDBException e) {
            throw new MessageStoreException("Failed to read message " + id, e);
        }
    }

    @Override
    public List<ChatMessage> findByParticipant(String userId, int limit) {
        return scanByTime(message -> message.involves(userId), limit, true);
    }

    @Override
    public List<ChatMessage> findConversation(String userId, String otherUserId, int limit) {
        return scanByTime(message -> message.isBetween(userId, otherUserId), limit, false);
    }

    @Override
    public List<ChatMessage> findCreatedSince(Instant since) {
        List<ChatMessage> messages = new ArrayList<>();

        try (RocksIterator iterator = db().newIterator(handle(MESSAGES_BY_TIME_CF))) {
            iterator.seek(ByteBuffer.allocate(Long.BYTES).putLong(since.toEpochMilli()).array());

            while (iterator.isValid()) {
                lookup(iterator.value())
                    .filter(message -> message.createdAt().isAfter(since))
                    .ifPresent(messages::add);
                iterator.next();
            }
        }

        return messages;
    }

    @Override
    public List<UserRecord> findAllUsers() {
        List<UserRecord> users = new ArrayList<>();

        try (RocksIterator iterator = db().newIterator(handle(USERS_CF))) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                users.add(readUser(iterator.value()));
                iterator.next();
            }
        }

        return users;
    }

    @Override
    public Optional<UserRecord> findUser(String id) {
        try {
            return Optional.ofNullable(db().get(handle(USERS_CF), idKey(id))).map(this::readUser);
        } catch (RocksDBException e) {
            throw new MessageStoreException("Failed to read user " + id, e);
        }
    }

    @Override
    public Set<String> findSenderIds() {
        Set<String> senders = new LinkedHashSet<>();

        try (RocksIterator iterator = db().newIterator(handle(MESSAGES_CF))) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                senders.add(readMessage(iterator.value()).fromUserId());
                iterator.next();
            }
        }

        return senders;
    }

    @Override
    public void upsertUsers(List<UserRecord> users) {
        if (users.isEmpty()) {
            return;
        }
        try (WriteBatch batch = new WriteBatch()) {
            for (UserRecord user : users) {
                batch.put(handle(USERS_CF), idKey(user.id()), objectMapper.writeValueAsBytes(user));
            }
            db().write(writeOptions, batch);
        } catch (RocksDBException | JsonProcessingException e) {
            throw new MessageStoreException("Failed to upsert " + users.size() + " users", e);
        }
    }

    @Override
    public void upsertMessages(List<ChatMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        try (WriteBatch batch = new WriteBatch()) {
            for (ChatMessage message : messages) {
                byte[] idKey = idKey(message.id());
                byte[] existing = db().get(handle(MESSAGES_CF), idKey);
                if (existing == null) {
                    batch.put(handle(MESSAGES_CF), idKey, objectMapper.writeValueAsBytes(message));
                    batch.put(handle(MESSAGES_BY_TIME_CF), timeKey(message), idKey);
                } else {
                    ChatMessage updated = readMessage(existing).withContent(message.content());
                    batch.put(handle(MESSAGES_CF), idKey, objectMapper.writeValueAsBytes(updated));
                }
            }
            db().write(writeOptions, batch);
        } catch (RocksDBException | JsonProcessingException e) {
            throw new MessageStoreException("Failed to upsert " + messages.size() + " messages", e);
        }
    }

    @Override
    public void verifyConnectivity() {
        try {
            db().getProperty(handle(MESSAGES_CF), "rocksdb.estimate-num-keys");
        } catch (RocksDBException e) {
            throw new MessageStoreException("Message store '" + name + "' is not responding", e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            verifyConnectivity();
            return true;
        } catch (MessageStoreException e) {
            log.warn("Health check of message store '{}' failed: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        RocksDB db = rocksDB;
        rocksDB = null;
        columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
        columnFamilyHandles.clear();
        if (db != null) {
            db.close();
        }
        if (writeOptions != null) {
            writeOptions.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        log.info("RocksDB message store '{}' closed", name);
    }

    private List<ChatMessage> scanByTime(Predicate<ChatMessage> filter, int limit, boolean newestFirst) {
        List<ChatMessage> messages = new ArrayList<>();

        try (RocksIterator iterator = db().newIterator(handle(MESSAGES_BY_TIME_CF))) {
            if (newestFirst) {
                iterator.seekToLast();
            } else {
                iterator.seekToFirst();
            }

            while (iterator.isValid() && messages.size() < limit) {
                lookup(iterator.value()).filter(filter).ifPresent(messages::add);
                if (newestFirst) {
                    iterator.prev();
                } else {
                    iterator.next();
                }
            }
        }

        return messages;
    }

    private Optional<ChatMessage> lookup(byte[] idKey) {
        try {
            return Optional.ofNullable(db().get(handle(MESSAGES_CF), idKey)).map(this::readMessage);
        } catch (RocksDBException e) {
            throw new MessageStoreException("Failed to read message " + new String(idKey, StandardCharsets.UTF_8), e);
        }
    }

    private ChatMessage readMessage(byte[] value) {
        try {
            return objectMapper.readValue(value, ChatMessage.class);
        } catch (IOException e) {
            throw new MessageStoreException("Corrupted message record in store '" + name + "'", e);
        }
    }

    private UserRecord readUser(byte[] value) {
        try {
            return objectMapper.readValue(value, UserRecord.class);
        } catch (IOException e) {
            throw new MessageStoreException("Corrupted user record in store '" + name + "'", e);
        }
    }

    private RocksDB db() {
        RocksDB db = rocksDB;
        if (db == null) {
            throw new MessageStoreException("Message store '" + name + "' is not open");
        }
        return db;
    }

    private ColumnFamilyHandle handle(String columnFamily) {
        return columnFamilyHandles.get(columnFamily);
    }

    private static byte[] idKey(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] timeKey(ChatMessage message) {
        byte[] id = idKey(message.id());
        return ByteBuffer.allocate(Long.BYTES + id.length)
            .putLong(message.createdAtMillis())
            .put(id)
            .array();
    }
}
