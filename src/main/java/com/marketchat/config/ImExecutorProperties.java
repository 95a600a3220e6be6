package com.marketchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 业务线程池配置。
 *
 * <ul>
 *   <li>db：落库/查库（投递状态机、在线状态写入），不能占用 Netty eventLoop</li>
 *   <li>push：离线推送（外部通知服务），慢调用不影响 db 池</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "im.executors")
public record ImExecutorProperties(
        Pool db,
        Pool push
) {

    public Pool dbEffective() {
        return db == null ? new Pool(null, null, null) : db;
    }

    public Pool pushEffective() {
        return push == null ? new Pool(2, 4, 1_000) : push;
    }

    public record Pool(
            Integer corePoolSize,
            Integer maxPoolSize,
            Integer queueCapacity
    ) {

        public int corePoolSizeEffective() {
            return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
        }

        public int maxPoolSizeEffective() {
            int max = maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
            return Math.max(max, corePoolSizeEffective());
        }

        public int queueCapacityEffective() {
            return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
        }
    }
}
