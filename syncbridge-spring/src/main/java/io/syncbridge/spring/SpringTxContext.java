package io.syncbridge.spring;

import io.syncbridge.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} over Spring-managed transactions.
 *
 * <p>The connection comes from {@link DataSourceUtils}, so queue rows are written inside the
 * same {@code @Transactional} boundary as the business mutation. After-commit callbacks are
 * registered as {@link TransactionSynchronization}s.
 *
 * <p>Requires transaction synchronization to be active (the Spring default);
 * {@code SYNCHRONIZATION_NEVER} leads to {@link IllegalStateException}.
 */
public final class SpringTxContext implements TxContext {
    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    public Connection currentConnection() {
        requireSynchronization("obtain connection");
        return DataSourceUtils.getConnection(dataSource);
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireSynchronization("register afterCommit callback");
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                callback.run();
            }
        });
    }

    private void requireSynchronization(String operation) {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active transaction; cannot " + operation);
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Transaction synchronization is not active; cannot " + operation);
        }
    }
}
