package com.prepro.mediation;

/**
 * Actor used by the mediation tests.
 */
record TestActor(String name, boolean admin) {

    static TestActor member(String name) {
        return new TestActor(name, false);
    }

    static TestActor admin(String name) {
        return new TestActor(name, true);
    }
}
