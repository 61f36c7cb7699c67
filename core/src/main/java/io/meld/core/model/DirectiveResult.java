package io.meld.core.model;

import io.meld.core.state.StateService;
import java.util.Objects;

/**
 * What a directive handler returns: the new state, optionally with a node that replaces the
 * directive in the transformed output.
 */
public sealed interface DirectiveResult permits DirectiveResult.StateOnly, DirectiveResult.WithReplacement {

    StateService state();

    /** State change only; the directive produces no visible output. */
    record StateOnly(StateService state) implements DirectiveResult {

        public StateOnly {
            Objects.requireNonNull(state, "state must not be null");
        }
    }

    /** State change plus the node that replaces the directive in transformation mode. */
    record WithReplacement(StateService state, Node replacement) implements DirectiveResult {

        public WithReplacement {
            Objects.requireNonNull(state, "state must not be null");
            Objects.requireNonNull(replacement, "replacement must not be null");
        }
    }
}
