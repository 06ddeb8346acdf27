package game.contracts;

import game.records.Diagnostic;

/**
 * Callback for recoverable problems found while editing or importing a game.
 *
 * <p>Operations that hit such a problem still return their usual "absent" result (an empty
 * {@code Optional}, {@code false}); the reporter lets a front-end or test harness see why without
 * parsing log output.</p>
 */
@FunctionalInterface
public interface Diagnostics {

    /**
     * Invoked once per problem, on the caller's thread.
     *
     * @param diagnostic immutable description of what went wrong
     */
    void report(Diagnostic diagnostic);
}
