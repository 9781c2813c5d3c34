package com.schoolsched.schoolsched_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

/**
 * Publish and delete run in a MongoDB transaction when this is on. Standalone servers
 * cannot run transactions; turn it off there and rely on the services' own rollback.
 */
@Configuration
public class MongoConfig {

    private static final Logger logger = LoggerFactory.getLogger(MongoConfig.class);

    @Bean
    @ConditionalOnProperty(name = "schedule.mongo.transactions-enabled", havingValue = "true", matchIfMissing = true)
    public PlatformTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        logger.info("MongoDB transaction manager enabled for schedule publish/delete");
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    @ConditionalOnProperty(name = "schedule.mongo.transactions-enabled", havingValue = "false")
    public PlatformTransactionManager passThroughTransactionManager() {
        logger.warn("MongoDB transactions disabled; publish/delete rely on compensating rollback only");
        return new PassThroughTransactionManager();
    }

    /**
     * Lets {@code @Transactional} methods run without a server-side transaction.
     */
    static class PassThroughTransactionManager extends AbstractPlatformTransactionManager {

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
            // nothing to open
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
            // writes are already applied
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
            logger.debug("Rollback requested without a transaction; services compensate their own writes");
        }
    }
}
