package info.isaksson.erland.reacttoangular.transform.rules;

/**
 * Pipeline stages in their only valid order. Event handling reads the setter map written by the
 * state-hook stage and the elements created by the template stage.
 */
public enum RuleStage {
    STATE_HOOKS,
    COMPONENT,
    TEMPLATE,
    EVENTS
}
