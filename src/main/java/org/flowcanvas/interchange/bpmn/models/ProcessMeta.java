package org.flowcanvas.interchange.bpmn.models;

/**
 * Preservation record of an enclosing {@code process} element, so the encoder can
 * reproduce the process tag faithfully.
 *
 * @param processId id of the process
 * @param laneSetId id of its lane set, null when it had none
 * @param content   attributes, documentation and the children that are neither nodes, flows nor the lane set
 */
public record ProcessMeta(String processId, String laneSetId, PreservedContent content) {
    public ProcessMeta {
        if (content == null) {
            content = PreservedContent.EMPTY;
        }
    }
}
