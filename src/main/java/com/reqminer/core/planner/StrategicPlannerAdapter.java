package com.reqminer.core.planner;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.intent.PlanningHints;
import com.reqminer.core.intent.RequestHeuristics;
import com.reqminer.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Prepares planner input for complex requests and calls the {@link StrategicPlanner}.
 * <p>
 * Planner failures are not recovered here; they surface as {@link StrategicPlanningException}
 * and fail the calling node.
 */
@Component
public class StrategicPlannerAdapter {

    private static final Logger log = LoggerFactory.getLogger(StrategicPlannerAdapter.class);

    private final StrategicPlanner planner;
    private final MiningProperties properties;

    public StrategicPlannerAdapter(StrategicPlanner planner, MiningProperties properties) {
        this.planner = planner;
        this.properties = properties;
    }

    /**
     * Builds the planning context for the request and asks the planner for a blueprint.
     * Only the most recent {@code maxPlanningHistory} clarification exchanges are passed on.
     */
    public MetaArchitectResult designBlueprint(String problem,
                                               IntentAnalysis intent,
                                               DemandAnalysis demandAnalysis,
                                               DemandState demandState,
                                               List<ClarificationExchange> history,
                                               MiningContext context) {
        EntitiesKeywords entities = RequestHeuristics.extractEntitiesAndKeywords(problem);
        var planningContext = new PlanningContext(
                demandState,
                demandAnalysis == null ? SmartCriteria.none() : demandAnalysis.criteria(),
                intent.categories(),
                intent.complexity(),
                intent.reasoning(),
                entities,
                PlanningHints.analysisFocus(intent),
                PlanningHints.frameworkHints(entities, intent),
                recent(history),
                context.domain());

        log.info("Requesting blueprint: focus={}, frameworks={}",
                planningContext.analysisFocus(), planningContext.frameworkHints());
        Blueprint blueprint = call("blueprint", () -> planner.plan(problem, planningContext, context));
        return new MetaArchitectResult(blueprint, null, entities, planningContext, problem);
    }

    /**
     * Attaches a roadmap to a confirmed blueprint.
     */
    public MetaArchitectResult attachRoadmap(MetaArchitectResult result, MiningContext context) {
        if (result.blueprint() == null) {
            throw new StrategicPlanningException("Cannot generate a roadmap without a blueprint");
        }
        Roadmap roadmap = call("roadmap", () -> planner.generateRoadmap(result.blueprint(), context));
        log.info("Roadmap generated with {} step(s)", roadmap.steps() == null ? 0 : roadmap.steps().size());
        return result.withRoadmap(roadmap);
    }

    private List<ClarificationExchange> recent(List<ClarificationExchange> history) {
        if (history == null) {
            return List.of();
        }
        int limit = properties.getMaxPlanningHistory();
        if (history.size() <= limit) {
            return history;
        }
        log.debug("Trimming clarification history from {} to {} exchange(s)", history.size(), limit);
        return List.copyOf(history.subList(history.size() - limit, history.size()));
    }

    private static <T> T call(String what, Supplier<T> action) {
        T value;
        try {
            value = action.get();
        } catch (StrategicPlanningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StrategicPlanningException("Strategic planner failed to produce " + what + ": "
                    + e.getMessage(), e);
        }
        if (value == null) {
            throw new StrategicPlanningException("Strategic planner returned no " + what);
        }
        return value;
    }
}
