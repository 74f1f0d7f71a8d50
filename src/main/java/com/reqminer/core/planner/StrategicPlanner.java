package com.reqminer.core.planner;

import com.reqminer.core.model.Blueprint;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.PlanningContext;
import com.reqminer.core.model.Roadmap;

/**
 * Produces solution designs for complex requests and turns confirmed designs into roadmaps.
 */
public interface StrategicPlanner {

    Blueprint plan(String problem, PlanningContext requirements, MiningContext context);

    Roadmap generateRoadmap(Blueprint blueprint, MiningContext context);
}
