package org.caureq.fleethub.gateway.ws;

import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.model.MetricSnapshot;

import java.util.List;
import java.util.Map;

/** Payload of the STATE event a subscriber receives first. */
record FleetState(List<Agent> agents, Map<String, MetricSnapshot> latest) {}
