package io.kvoperator.api.handlers;

import io.kvoperator.api.models.responses.ErrorResponse;
import io.kvoperator.desired.DesiredStateManager;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.store.StaleRevisionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for replica groups.
 *
 * Supported operations:
 * - GET /{clusterId}/groups - All group specs
 * - GET /{clusterId}/groups/{group} - One group spec
 * - PUT /{clusterId}/groups/{group} - Create or replace a group spec, triggers reconciliation
 * - GET /{clusterId}/groups/{group}/status - Group status
 * - GET /{clusterId}/groups/{group}/instances - Instance records
 */
@Slf4j
@RestController
@RequestMapping("/{clusterId}/groups")
public class GroupHandler {

    private final DesiredStateManager desiredStateManager;

    public GroupHandler(DesiredStateManager desiredStateManager) {
        this.desiredStateManager = desiredStateManager;
    }

    @GetMapping
    public ResponseEntity<Object> listGroups(@PathVariable String clusterId) {
        try {
            return ResponseEntity.ok(desiredStateManager.listGroups(clusterId));
        } catch (Exception e) {
            log.error("Error listing groups of cluster '{}': {}", clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{group}")
    public ResponseEntity<Object> getGroup(@PathVariable String clusterId, @PathVariable String group) {
        try {
            return desiredStateManager.getGroupSpec(clusterId, group)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> groupNotFound(group));
        } catch (Exception e) {
            log.error("Error getting group '{}' of cluster '{}': {}", group, clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PutMapping("/{group}")
    public ResponseEntity<Object> putGroup(@PathVariable String clusterId,
                                           @PathVariable String group,
                                           @RequestBody DesiredSpec request) {
        try {
            log.info("Setting spec of group '{}' in cluster '{}'", group, clusterId);
            return ResponseEntity.ok(desiredStateManager.putGroupSpec(clusterId, group, request));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid spec for group '{}' in cluster '{}': {}", group, clusterId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (StaleRevisionException e) {
            log.warn("Concurrent update of group '{}' in cluster '{}': {}", group, clusterId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.conflict(e.getMessage()));
        } catch (Exception e) {
            log.error("Error setting group '{}' in cluster '{}': {}", group, clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{group}/status")
    public ResponseEntity<Object> getGroupStatus(@PathVariable String clusterId, @PathVariable String group) {
        try {
            return desiredStateManager.getGroupStatus(clusterId, group)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ErrorResponse.notFound("Status of group '" + group + "'")));
        } catch (Exception e) {
            log.error("Error getting status of group '{}' in cluster '{}': {}", group, clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{group}/instances")
    public ResponseEntity<Object> listInstances(@PathVariable String clusterId, @PathVariable String group) {
        try {
            if (desiredStateManager.getGroupSpec(clusterId, group).isEmpty()) {
                return groupNotFound(group);
            }
            return ResponseEntity.ok(desiredStateManager.listInstances(clusterId, group));
        } catch (Exception e) {
            log.error("Error listing instances of group '{}' in cluster '{}': {}", group, clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    private static ResponseEntity<Object> groupNotFound(String group) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Group '" + group + "'"));
    }
}
