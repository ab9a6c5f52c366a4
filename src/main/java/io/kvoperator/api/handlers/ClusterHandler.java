package io.kvoperator.api.handlers;

import io.kvoperator.api.models.responses.ErrorResponse;
import io.kvoperator.desired.DesiredStateManager;
import io.kvoperator.models.ClusterSpec;
import io.kvoperator.store.StaleRevisionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for cluster-wide desired state and status.
 *
 * Supported operations:
 * - GET /{clusterId} - Cluster spec
 * - PUT /{clusterId} - Create or replace the cluster spec (paused flag, coordinator endpoint)
 * - GET /{clusterId}/_status - Cluster status rolled up from all groups
 */
@Slf4j
@RestController
@RequestMapping("/{clusterId}")
public class ClusterHandler {

    private final DesiredStateManager desiredStateManager;

    public ClusterHandler(DesiredStateManager desiredStateManager) {
        this.desiredStateManager = desiredStateManager;
    }

    @GetMapping
    public ResponseEntity<Object> getClusterSpec(@PathVariable String clusterId) {
        try {
            log.info("Getting spec of cluster '{}'", clusterId);
            return desiredStateManager.getClusterSpec(clusterId)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ErrorResponse.notFound("Cluster '" + clusterId + "'")));
        } catch (Exception e) {
            log.error("Error getting spec of cluster '{}': {}", clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PutMapping
    public ResponseEntity<Object> putClusterSpec(@PathVariable String clusterId, @RequestBody ClusterSpec request) {
        try {
            log.info("Setting spec of cluster '{}'", clusterId);
            return ResponseEntity.ok(desiredStateManager.putClusterSpec(clusterId, request));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid spec for cluster '{}': {}", clusterId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (StaleRevisionException e) {
            log.warn("Concurrent update of cluster '{}' spec: {}", clusterId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.conflict(e.getMessage()));
        } catch (Exception e) {
            log.error("Error setting spec of cluster '{}': {}", clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/_status")
    public ResponseEntity<Object> getClusterStatus(@PathVariable String clusterId) {
        try {
            return desiredStateManager.getClusterStatus(clusterId)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ErrorResponse.notFound("Status of cluster '" + clusterId + "'")));
        } catch (Exception e) {
            log.error("Error getting status of cluster '{}': {}", clusterId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
