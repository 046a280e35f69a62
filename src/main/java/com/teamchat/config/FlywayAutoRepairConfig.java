package com.teamchat.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发环境常见：改过已执行的迁移脚本导致 checksum 不一致。validate 失败时先 repair 再 migrate。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return FlywayAutoRepairConfig::validateRepairMigrate;
    }

    static void validateRepairMigrate(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("Flyway: validate failed, repair() then migrate(): {}", e.getMessage());
            try {
                flyway.repair();
            } catch (Exception repairError) {
                log.warn("Flyway: repair() failed, continue migrate()", repairError);
            }
        } catch (Exception e) {
            log.warn("Flyway: validate() failed, continue migrate()", e);
        }
        flyway.migrate();
    }
}
