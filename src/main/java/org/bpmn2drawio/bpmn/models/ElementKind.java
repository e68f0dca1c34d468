package org.bpmn2drawio.bpmn.models;

/**
 * Closed set of element kinds. Each category carries its own sub-variant, so
 * consumers switch on {@link #category()} and then read the variant record.
 */
public sealed interface ElementKind
        permits ElementKind.EventKind, ElementKind.ActivityKind, ElementKind.GatewayKind,
        ElementKind.ArtifactKind, ElementKind.GenericKind {

    Category category();

    /** Tag name as it appears in BPMN XML. */
    String tag();

    record EventKind(EventPosition position, EventTrigger trigger) implements ElementKind {
        @Override
        public Category category() {
            return Category.EVENT;
        }

        @Override
        public String tag() {
            return position.tag();
        }
    }

    record ActivityKind(ActivityType type, LoopMarker loop) implements ElementKind {
        public ActivityKind(ActivityType type) {
            this(type, LoopMarker.NONE);
        }

        @Override
        public Category category() {
            return Category.ACTIVITY;
        }

        @Override
        public String tag() {
            return type.tag();
        }
    }

    record GatewayKind(GatewayType type) implements ElementKind {
        @Override
        public Category category() {
            return Category.GATEWAY;
        }

        @Override
        public String tag() {
            return type.tag();
        }
    }

    record ArtifactKind(ArtifactType type) implements ElementKind {
        @Override
        public Category category() {
            return Category.ARTIFACT;
        }

        @Override
        public String tag() {
            return type.tag();
        }
    }

    /** Fallback for tags the builder does not recognize; keeps the raw tag. */
    record GenericKind(String tag) implements ElementKind {
        @Override
        public Category category() {
            return Category.GENERIC;
        }
    }
}
