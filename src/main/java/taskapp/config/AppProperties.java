package taskapp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings under the {@code app} prefix.
 *
 * <pre>
 * app:
 *   reconciliation:
 *     max-attempts: 2
 *   query:
 *     user-default-limit: 0
 *     task-default-limit: 100
 * </pre>
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Reconciliation reconciliation = new Reconciliation();
    private final Query query = new Query();

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Query getQuery() {
        return query;
    }

    /**
     * Cross-entity update settings.
     */
    public static class Reconciliation {

        /** Times each reconciliation step is tried before it is logged as failed. */
        private int maxAttempts = 2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    /**
     * List endpoint defaults. A limit of {@code 0} means unlimited.
     */
    public static class Query {

        private int userDefaultLimit;
        private int taskDefaultLimit = 100;

        public int getUserDefaultLimit() {
            return userDefaultLimit;
        }

        public void setUserDefaultLimit(final int userDefaultLimit) {
            this.userDefaultLimit = userDefaultLimit;
        }

        public int getTaskDefaultLimit() {
            return taskDefaultLimit;
        }

        public void setTaskDefaultLimit(final int taskDefaultLimit) {
            this.taskDefaultLimit = taskDefaultLimit;
        }
    }
}
