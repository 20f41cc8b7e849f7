package xyz.firestige.redis.taskindex.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 原子批次
 *
 * <p>一组按顺序记录的写命令，由 {@link RedisClient#execute(RedisBatch)} 整体提交：
 * 要么全部生效，要么全部不生效。所有写操作都必须通过批次表达，不允许逐条独立调用。
 *
 * <p>示例:
 * <pre>{@code
 * RedisBatch batch = RedisBatch.builder()
 *     .hset("task:42", fields)
 *     .sadd("user:u1:tasks", "42")
 *     .zadd("user:u1:tasks:sorted", "42", createdAt)
 *     .build();
 * redisClient.execute(batch);
 * }</pre>
 *
 * @since 1.0
 */
public final class RedisBatch {

    /**
     * 命令类型
     */
    public enum CommandType {
        /** 写入多个 Hash 字段 */
        HSET,
        /** 删除 Hash 字段 */
        HDEL,
        /** 添加集合成员 */
        SADD,
        /** 移除集合成员 */
        SREM,
        /** 添加有序集合成员 */
        ZADD,
        /** 移除有序集合成员 */
        ZREM,
        /** 删除整个 Key */
        DEL
    }

    private final List<Command> commands;

    private RedisBatch(List<Command> commands) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Command> getCommands() {
        return commands;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public int size() {
        return commands.size();
    }

    @Override
    public String toString() {
        return "RedisBatch" + commands;
    }

    /**
     * 单条命令
     *
     * <p>{@code fields} 仅 HSET 使用；{@code members} 对 HDEL 是字段名，对集合类命令是成员；
     * {@code score} 仅 ZADD 使用。
     */
    public static final class Command {
        private final CommandType type;
        private final String key;
        private final Map<String, String> fields;
        private final List<String> members;
        private final double score;

        private Command(CommandType type, String key, Map<String, String> fields,
                        List<String> members, double score) {
            this.type = type;
            this.key = Objects.requireNonNull(key, "key cannot be null");
            this.fields = fields;
            this.members = members;
            this.score = score;
        }

        public CommandType getType() {
            return type;
        }

        public String getKey() {
            return key;
        }

        public Map<String, String> getFields() {
            return fields;
        }

        public List<String> getMembers() {
            return members;
        }

        public double getScore() {
            return score;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(type.name()).append(' ').append(key);
            if (!fields.isEmpty()) {
                sb.append(' ').append(fields.keySet());
            }
            if (!members.isEmpty()) {
                sb.append(' ').append(members);
            }
            if (type == CommandType.ZADD) {
                sb.append(" score=").append(score);
            }
            return sb.toString();
        }
    }

    public static final class Builder {
        private final List<Command> commands = new ArrayList<>();

        private Builder() {
        }

        public Builder hset(String key, Map<String, String> fields) {
            Objects.requireNonNull(fields, "fields cannot be null");
            if (fields.isEmpty()) {
                return this;
            }
            commands.add(new Command(CommandType.HSET, key,
                Collections.unmodifiableMap(new LinkedHashMap<>(fields)), List.of(), 0));
            return this;
        }

        public Builder hset(String key, String field, String value) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(field, value);
            return hset(key, fields);
        }

        public Builder hdel(String key, String... fields) {
            return add(CommandType.HDEL, key, Arrays.asList(fields));
        }

        public Builder sadd(String key, String... members) {
            return add(CommandType.SADD, key, Arrays.asList(members));
        }

        public Builder sadd(String key, Collection<String> members) {
            return add(CommandType.SADD, key, members);
        }

        public Builder srem(String key, String... members) {
            return add(CommandType.SREM, key, Arrays.asList(members));
        }

        public Builder zadd(String key, String member, double score) {
            commands.add(new Command(CommandType.ZADD, key, Map.of(), List.of(member), score));
            return this;
        }

        public Builder zrem(String key, String... members) {
            return add(CommandType.ZREM, key, Arrays.asList(members));
        }

        public Builder del(String key) {
            commands.add(new Command(CommandType.DEL, key, Map.of(), List.of(), 0));
            return this;
        }

        public RedisBatch build() {
            return new RedisBatch(commands);
        }

        private Builder add(CommandType type, String key, Collection<String> members) {
            Objects.requireNonNull(members, "members cannot be null");
            // SADD/SREM 等命令不接受空成员列表
            if (members.isEmpty()) {
                return this;
            }
            commands.add(new Command(type, key, Map.of(), List.copyOf(members), 0));
            return this;
        }
    }
}
