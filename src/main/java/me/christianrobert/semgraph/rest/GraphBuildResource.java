package me.christianrobert.semgraph.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.semgraph.config.GraphConfigService;
import me.christianrobert.semgraph.context.BuildLimits;
import me.christianrobert.semgraph.context.GraphBuildResult;
import me.christianrobert.semgraph.service.SemanticGraphService;
import me.christianrobert.semgraph.source.SourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for building semantic graphs from source trees.
 *
 * <p>Meant for development and debugging: post the JSON form of a {@link SourceNode} and
 * look at the graph that comes back.</p>
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/graph/expression?rootId=expr/0&amp;showTree=true" \
 *   -H "Content-Type: application/json" \
 *   --data '{"kind":"OPERATOR","tag":"+","children":[{"kind":"VARIABLE","tag":"x"},{"kind":"LITERAL","tag":"integer","value":1}]}'
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A failed build is a valid business outcome, not an HTTP error.
 */
@Path("/api/graph")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class GraphBuildResource {

    private static final Logger log = LoggerFactory.getLogger(GraphBuildResource.class);

    @Inject
    SemanticGraphService graphService;

    @Inject
    GraphConfigService configService;

    /**
     * Builds the graph of one expression.
     *
     * @param rootId Root node id (defaults to expr/0)
     * @param maxDepth Optional depth ceiling for this request
     * @param maxCaptures Optional capture ceiling for this request
     * @param showTree Include the formatted source tree in the response
     * @param node Source tree (JSON body)
     */
    @POST
    @Path("/expression")
    public GraphBuildResult buildExpression(
            @QueryParam("rootId") @DefaultValue("expr/0") String rootId,
            @QueryParam("maxDepth") Integer maxDepth,
            @QueryParam("maxCaptures") Integer maxCaptures,
            @QueryParam("showTree") @DefaultValue("false") boolean showTree,
            SourceNode node
    ) {
        log.info("Expression graph request received: rootId={}", rootId);
        if (node == null) {
            log.warn("Empty source tree received");
            return GraphBuildResult.failure("Source tree cannot be empty");
        }

        BuildLimits limits;
        try {
            limits = limits(maxDepth, maxCaptures);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid limits: {}", e.getMessage());
            return GraphBuildResult.failure("Invalid limits: " + e.getMessage());
        }

        GraphBuildResult result = graphService.buildExpression(node, rootId, limits);
        logOutcome(result);
        return showTree ? graphService.withSourceTree(result, node) : result;
    }

    /**
     * Builds the graph of a module definition; failing top-level constructs are reported, not fatal.
     */
    @POST
    @Path("/module")
    public GraphBuildResult buildModule(
            @QueryParam("rootId") @DefaultValue("module/0") String rootId,
            @QueryParam("maxDepth") Integer maxDepth,
            @QueryParam("maxCaptures") Integer maxCaptures,
            SourceNode node
    ) {
        log.info("Module graph request received: rootId={}", rootId);
        if (node == null) {
            log.warn("Empty source tree received");
            return GraphBuildResult.failure("Source tree cannot be empty");
        }

        BuildLimits limits;
        try {
            limits = limits(maxDepth, maxCaptures);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid limits: {}", e.getMessage());
            return GraphBuildResult.failure("Invalid limits: " + e.getMessage());
        }

        GraphBuildResult result = graphService.buildModule(node, rootId, limits);
        logOutcome(result);
        return result;
    }

    /**
     * Builds an expression and returns only the node list in bulk-load form.
     * Failures come back as the failure result.
     */
    @POST
    @Path("/export")
    public String exportExpression(
            @QueryParam("rootId") @DefaultValue("expr/0") String rootId,
            SourceNode node
    ) {
        log.info("Graph export request received: rootId={}", rootId);
        GraphBuildResult result = node == null
                ? GraphBuildResult.failure("Source tree cannot be empty")
                : graphService.buildExpression(node, rootId, configService.currentLimits());
        logOutcome(result);
        return graphService.exportJson(result);
    }

    private BuildLimits limits(Integer maxDepth, Integer maxCaptures) {
        BuildLimits limits = configService.currentLimits();
        if (maxDepth != null) {
            limits = limits.withMaxDepth(maxDepth);
        }
        if (maxCaptures != null) {
            limits = limits.withMaxCaptures(maxCaptures);
        }
        return limits;
    }

    private void logOutcome(GraphBuildResult result) {
        if (result.isSuccess()) {
            log.info("Graph build succeeded: {} nodes", result.getNodes().size());
            if (!result.getConstructFailures().isEmpty()) {
                log.warn("{} constructs were dropped", result.getConstructFailures().size());
            }
        } else {
            log.warn("Graph build failed: {}", result.getErrorMessage());
        }
    }
}
