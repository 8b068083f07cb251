package com.salescompass.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sink for the steps the resolver walks through. The silent variant discards everything.
 */
interface DecisionTrace {

    void step(String message);

    List<String> steps();

    static DecisionTrace silent() {
        return Silent.INSTANCE;
    }

    static DecisionTrace recording() {
        return new Recording();
    }

    final class Silent implements DecisionTrace {

        private static final Silent INSTANCE = new Silent();

        @Override
        public void step(String message) {
        }

        @Override
        public List<String> steps() {
            return List.of();
        }
    }

    final class Recording implements DecisionTrace {

        private final List<String> steps = new ArrayList<>();

        @Override
        public void step(String message) {
            steps.add(message);
        }

        @Override
        public List<String> steps() {
            return Collections.unmodifiableList(steps);
        }
    }
}
