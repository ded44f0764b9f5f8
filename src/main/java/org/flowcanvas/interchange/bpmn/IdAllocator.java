package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.NodeKind;

import java.util.Collection;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Hands out element ids of the form {@code <TypeName>_<6 uppercase hex digits>}, plus the
 * legacy counter-based {@code <tag>_<n>} ids used when a decoded element has no id.
 * <p>
 * One instance belongs to one editing session. Not thread-safe.
 */
public class IdAllocator {
    private static final String UNKNOWN_TYPE_NAME = "Element";
    private static final int MAX_ATTEMPTS = 64;
    private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");

    private static final Map<String, String> TYPE_NAMES = Map.ofEntries(
            entry("startEvent", "StartEvent"),
            entry("endEvent", "EndEvent"),
            entry("intermediateEvent", "IntermediateEvent"),
            entry("intermediateCatchEvent", "IntermediateCatchEvent"),
            entry("intermediateThrowEvent", "IntermediateThrowEvent"),
            entry("boundaryEvent", "BoundaryEvent"),
            entry("task", "Task"),
            entry("serviceTask", "ServiceTask"),
            entry("userTask", "UserTask"),
            entry("scriptTask", "ScriptTask"),
            entry("businessRuleTask", "BusinessRuleTask"),
            entry("sendTask", "SendTask"),
            entry("receiveTask", "ReceiveTask"),
            entry("manualTask", "ManualTask"),
            entry("subProcess", "SubProcess"),
            entry("callActivity", "CallActivity"),
            entry("exclusiveGateway", "ExclusiveGateway"),
            entry("inclusiveGateway", "InclusiveGateway"),
            entry("parallelGateway", "ParallelGateway"),
            entry("eventBasedGateway", "EventBasedGateway"),
            entry("complexGateway", "ComplexGateway"),
            entry("gateway", "Gateway"),
            entry("dataObject", "DataObject"),
            entry("dataObjectReference", "DataObjectReference"),
            entry("dataStore", "DataStore"),
            entry("dataStoreReference", "DataStoreReference"),
            entry("group", "Group"),
            entry("textAnnotation", "TextAnnotation"),
            entry("participant", "Participant"),
            entry("lane", "Lane"),
            entry("laneSet", "LaneSet"),
            entry("process", "Process"),
            entry("collaboration", "Collaboration"),
            entry("definitions", "Definitions"),
            entry("sequenceFlow", "Flow"),
            entry("messageFlow", "MessageFlow"));

    private final Random random;
    private long counter = 1;

    public IdAllocator() {
        this(new Random());
    }

    /**
     * @param random source of the hex suffixes; pass a seeded instance for reproducible ids
     */
    public IdAllocator(Random random) {
        this.random = random;
    }

    public String generateId(String tag) {
        String typeName = tag == null ? UNKNOWN_TYPE_NAME : TYPE_NAMES.getOrDefault(tag, UNKNOWN_TYPE_NAME);
        return String.format("%s_%06X", typeName, random.nextInt(0x1000000));
    }

    public String generateId(NodeKind kind) {
        return generateId(kind.tag());
    }

    /**
     * Like {@link #generateId(String)}, but draws again while the id is already taken.
     */
    public String generateId(String tag, Set<String> takenIds) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String id = generateId(tag);
            if (!takenIds.contains(id)) {
                return id;
            }
        }
        // 24 bits of suffix exhausted for practical purposes; fall back to the counter
        String id;
        do {
            id = nextFallbackId(tag);
        } while (takenIds.contains(id));
        return id;
    }

    /**
     * Legacy sequential id, {@code <tag>_<n>}, for elements decoded without an id.
     */
    public String nextFallbackId(String tag) {
        return tag + "_" + counter++;
    }

    /**
     * Moves the counter past {@code maxObservedSuffix} so fallback ids never collide with
     * decoded ones.
     */
    public void reseed(long maxObservedSuffix) {
        counter = Math.max(counter, maxObservedSuffix + 1);
    }

    /**
     * Reseeds from the trailing decimal digits of the given ids.
     */
    public void reseedFrom(Collection<String> ids) {
        long max = 0;
        for (String id : ids) {
            if (id == null) {
                continue;
            }
            Matcher matcher = TRAILING_DIGITS.matcher(id);
            // more than 18 digits would not fit a long
            if (matcher.find() && matcher.group(1).length() <= 18) {
                max = Math.max(max, Long.parseLong(matcher.group(1)));
            }
        }
        reseed(max);
    }

    long peekCounter() {
        return counter;
    }
}
