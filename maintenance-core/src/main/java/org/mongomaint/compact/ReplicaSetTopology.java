package org.mongomaint.compact;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.NodeTarget;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Reads the replica set configuration and status to find the members compaction can be routed
 * to. Members are addressed through their {@value #AVAILABILITY_ZONE_TAG} tag when they have one.
 */
@RequiredArgsConstructor
public class ReplicaSetTopology {
    public static final String AVAILABILITY_ZONE_TAG = "availabilityZone";
    static final int STATE_PRIMARY = 1;
    static final int STATE_SECONDARY = 2;

    private final DatabaseClient client;

    /** A healthy secondary; {@code zone} is its availability zone, or its host when untagged. */
    public record SecondaryTarget(String zone, NodeTarget target) {}

    /** A configured member joined with its current state. */
    public record Member(int id, String host, String zone, int state) {
        public boolean isPrimary() {
            return state == STATE_PRIMARY;
        }

        public boolean isSecondary() {
            return state == STATE_SECONDARY;
        }
    }

    public Mono<List<Member>> members() {
        return Mono.zip(
            client.runAdminCommand(Commands.replSetGetConfig()),
            client.runAdminCommand(Commands.replSetGetStatus())
        ).map(replies -> join(replies.getT1(), replies.getT2()));
    }

    /**
     * Distinct secondaries, one per host, with members in {@code preferredZones} first and
     * configuration order otherwise.
     */
    public Mono<List<SecondaryTarget>> secondaryTargets(List<String> preferredZones) {
        return members().map(members -> {
            var seenHosts = new HashSet<String>();
            var preferred = new ArrayList<SecondaryTarget>();
            var others = new ArrayList<SecondaryTarget>();
            for (var member : members) {
                if (!member.isSecondary() || !seenHosts.add(member.host())) {
                    continue;
                }
                var target = member.zone() != null
                    ? NodeTarget.secondary(member.zone(), Map.of(AVAILABILITY_ZONE_TAG, member.zone()))
                    : NodeTarget.secondary(member.host());
                var zone = member.zone() != null ? member.zone() : member.host();
                (preferredZones.contains(zone) ? preferred : others).add(new SecondaryTarget(zone, target));
            }
            preferred.addAll(others);
            return preferred;
        });
    }

    public Mono<Optional<Member>> primaryMember() {
        return members().map(members -> members.stream().filter(Member::isPrimary).findFirst());
    }

    static List<Member> join(JsonNode configReply, JsonNode statusReply) {
        var stateById = new HashMap<Integer, Integer>();
        for (var status : statusReply.path("members")) {
            stateById.put(status.path("_id").asInt(), status.path("state").asInt(-1));
        }
        var members = new ArrayList<Member>();
        for (var config : configReply.path("config").path("members")) {
            var id = config.path("_id").asInt();
            var host = config.path("host").asText("member-" + id);
            var zoneNode = config.path("tags").path(AVAILABILITY_ZONE_TAG);
            var zone = zoneNode.isTextual() && !zoneNode.asText().isEmpty() ? zoneNode.asText() : null;
            members.add(new Member(id, host, zone, stateById.getOrDefault(id, -1)));
        }
        return members;
    }
}
