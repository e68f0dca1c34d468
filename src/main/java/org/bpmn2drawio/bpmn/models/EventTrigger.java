package org.bpmn2drawio.bpmn.models;

/**
 * Event trigger, taken from the {@code *EventDefinition} child of an event.
 * An event without a definition is {@link #NONE}.
 */
public enum EventTrigger {
    NONE(null),
    MESSAGE("messageEventDefinition"),
    TIMER("timerEventDefinition"),
    SIGNAL("signalEventDefinition"),
    ERROR("errorEventDefinition"),
    ESCALATION("escalationEventDefinition"),
    CONDITIONAL("conditionalEventDefinition"),
    COMPENSATION("compensateEventDefinition"),
    CANCEL("cancelEventDefinition"),
    TERMINATE("terminateEventDefinition"),
    LINK("linkEventDefinition");

    private final String definitionTag;

    EventTrigger(String definitionTag) {
        this.definitionTag = definitionTag;
    }

    public String definitionTag() {
        return definitionTag;
    }

    /**
     * @param definitionTag local name of the event definition element
     * @return the matching trigger, or null when the definition is not known
     */
    public static EventTrigger fromDefinitionTag(String definitionTag) {
        for (EventTrigger trigger : values()) {
            if (definitionTag.equals(trigger.definitionTag)) {
                return trigger;
            }
        }
        return null;
    }
}
