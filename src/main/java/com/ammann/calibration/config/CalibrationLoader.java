/* (C)2026 */
package com.ammann.calibration.config;

import com.ammann.calibration.enumeration.DependencyKind;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.CalibrationException;
import com.ammann.calibration.model.BoundedParameter;
import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.model.CalibrationLayer;
import com.ammann.calibration.model.DependencyEdge;
import com.ammann.calibration.model.DependencyGraph;
import com.ammann.calibration.model.DependencyNode;
import com.ammann.calibration.model.EvidenceReference;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.InteractionTerm;
import com.ammann.calibration.model.LayerPair;
import com.ammann.calibration.model.MultiplicativeBounds;
import com.ammann.calibration.service.InteractionGovernor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reads a calibration document and turns it into a validated {@link CalibrationContext}.
 *
 * <p>Every structural check runs here, before any evaluation is served: bounds,
 * provenance, weight normalization, interaction density, acyclicity and tier ordering.
 * The first violation aborts the load with a {@link CalibrationException} naming the
 * offending item.
 *
 * <p>Locations starting with {@code classpath:} are read from the class path, anything
 * else from the file system.
 */
@ApplicationScoped
public class CalibrationLoader {

    private static final Logger LOG = Logger.getLogger(CalibrationLoader.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    @ConfigProperty(name = "calibration.config.location", defaultValue = "classpath:calibration/cohort-2024.json")
    String location;

    private final InteractionGovernor governor;

    @Inject
    public CalibrationLoader(InteractionGovernor governor) {
        this.governor = governor;
    }

    /** Loads the configured calibration document. */
    public CalibrationContext load() {
        return load(location);
    }

    /**
     * Loads and validates the calibration document at {@code location}.
     *
     * @throws CalibrationException if the document is missing, malformed or violates an invariant
     */
    public CalibrationContext load(String location) {
        try {
            CalibrationContext context = build(read(location));
            LOG.infof(
                    "Calibration loaded from %s: cohort=%s version=%s roles=%s layers=%d fingerprint=%s",
                    location, context.cohort(), context.version(), context.weightSets().keySet(),
                    context.currentLayers().size(), context.fingerprint());
            return context;
        } catch (CalibrationException e) {
            LOG.errorf("Calibration load from %s failed: %s", location, e.getMessage());
            throw e;
        }
    }

    CalibrationDocument read(String location) {
        if (location == null || location.isBlank()) {
            throw new CalibrationException("No calibration location configured (calibration.config.location)");
        }
        try (InputStream in = open(location)) {
            return MAPPER.readValue(in, CalibrationDocument.class);
        } catch (IOException e) {
            throw new CalibrationException("Calibration document " + location + " cannot be read: " + e.getMessage(), e);
        }
    }

    CalibrationContext build(CalibrationDocument document) {
        String cohort = document.cohort();

        List<FusionWeightSet> weightSets = new ArrayList<>();
        if (document.fusionWeights() == null || document.fusionWeights().isEmpty()) {
            throw new CalibrationException("Calibration " + cohort + " defines no fusion_weights");
        }
        document.fusionWeights().forEach((role, entry) -> weightSets.add(toWeightSet(cohort, role, entry)));

        List<CalibrationLayer> layers = new ArrayList<>();
        if (document.layers() != null) {
            document.layers().forEach(entry -> layers.add(toLayer(entry)));
        }

        if (document.dependencyGraph() == null) {
            throw new CalibrationException("Calibration " + cohort + " has no dependency_graph");
        }
        DependencyGraph graph = toGraph(document.dependencyGraph());

        List<String> order = governor.validate(graph);
        weightSets.forEach(governor::certify);

        MultiplicativeBounds bounds = document.multiplicativeBounds() == null
                ? governor.configuredBounds()
                : new MultiplicativeBounds(
                        require(document.multiplicativeBounds().min(), "multiplicative_bounds.min"),
                        require(document.multiplicativeBounds().max(), "multiplicative_bounds.max"));

        return new CalibrationContext(
                cohort, document.version(), weightSets, layers, graph, order, bounds);
    }

    private FusionWeightSet toWeightSet(String cohort, String roleName, CalibrationDocument.WeightSetEntry entry) {
        FusionRole role;
        try {
            role = FusionRole.valueOf(roleName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CalibrationException("Unknown fusion role '" + roleName + "' in fusion_weights");
        }
        if (entry == null || entry.linear() == null) {
            throw new CalibrationException("Role " + role + " has no linear weights");
        }

        Map<LayerId, Double> linear = new EnumMap<>(LayerId.class);
        entry.linear().forEach((symbol, weight) -> linear.put(layer(symbol, "fusion_weights." + roleName), weight));

        List<InteractionTerm> interactions = new ArrayList<>();
        if (entry.interactions() != null) {
            for (CalibrationDocument.InteractionEntry interaction : entry.interactions()) {
                if (interaction.layers() == null || interaction.layers().size() != 2) {
                    throw new CalibrationException(
                            "Interaction in role " + role + " must name exactly two layers, got " + interaction.layers());
                }
                LayerPair pair = LayerPair.of(
                        layer(interaction.layers().get(0), "interaction of " + role),
                        layer(interaction.layers().get(1), "interaction of " + role));
                interactions.add(new InteractionTerm(pair, require(interaction.weight(), "weight of " + pair)));
            }
        }
        String id = (cohort == null ? "" : cohort + "/") + role.name();
        return new FusionWeightSet(id, role, linear, interactions);
    }

    private CalibrationLayer toLayer(CalibrationDocument.LayerEntry entry) {
        List<BoundedParameter> parameters = new ArrayList<>();
        if (entry.parameters() != null) {
            for (CalibrationDocument.ParameterEntry parameter : entry.parameters()) {
                String name = parameter.name();
                parameters.add(BoundedParameter.of(
                        name,
                        require(parameter.value(), entry.layerId() + "." + name + ".value"),
                        require(parameter.lower(), entry.layerId() + "." + name + ".lower"),
                        require(parameter.upper(), entry.layerId() + "." + name + ".upper")));
            }
        }
        List<EvidenceReference> evidence = new ArrayList<>();
        if (entry.evidence() != null) {
            entry.evidence().forEach(e -> evidence.add(new EvidenceReference(e.locator(), e.contentId())));
        }
        return new CalibrationLayer(
                entry.layerId(), entry.version(), parameters, entry.rationale(), evidence,
                instant(entry.createdAt(), entry.layerId()));
    }

    private DependencyGraph toGraph(CalibrationDocument.GraphEntry entry) {
        List<DependencyNode> nodes = new ArrayList<>();
        if (entry.nodes() != null) {
            for (CalibrationDocument.NodeEntry node : entry.nodes()) {
                nodes.add(new DependencyNode(node.id(), tier(node.tier(), node.id())));
            }
        }
        List<DependencyEdge> edges = new ArrayList<>();
        if (entry.edges() != null) {
            for (CalibrationDocument.EdgeEntry edge : entry.edges()) {
                edges.add(new DependencyEdge(edge.from(), edge.to(), kind(edge)));
            }
        }
        return new DependencyGraph(nodes, edges);
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            InputStream in = loader == null ? null : loader.getResourceAsStream(resource);
            if (in == null) {
                in = CalibrationLoader.class.getClassLoader().getResourceAsStream(resource);
            }
            if (in == null) {
                throw new CalibrationException("Calibration resource not found on class path: " + resource);
            }
            return in;
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new CalibrationException("Calibration file not found: " + path.toAbsolutePath());
        }
        return Files.newInputStream(path);
    }

    private static LayerId layer(String symbol, String where) {
        return LayerId.fromSymbol(symbol)
                .orElseThrow(() -> new CalibrationException("Unknown layer symbol '" + symbol + "' in " + where));
    }

    private static EpistemicTier tier(String tier, String nodeId) {
        if (tier == null) {
            throw new CalibrationException("Dependency node '" + nodeId + "' has no tier");
        }
        try {
            return EpistemicTier.valueOf(tier.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CalibrationException("Dependency node '" + nodeId + "' has unknown tier '" + tier + "'");
        }
    }

    private static DependencyKind kind(CalibrationDocument.EdgeEntry edge) {
        if (edge.kind() == null) {
            return DependencyKind.PRIMARY;
        }
        try {
            return DependencyKind.valueOf(edge.kind().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CalibrationException(String.format(
                    "Edge %s -> %s has unknown kind '%s'", edge.from(), edge.to(), edge.kind()));
        }
    }

    private static Instant instant(String value, String layerId) {
        if (value == null) {
            throw new CalibrationException("Layer '" + layerId + "' has no created_at");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new CalibrationException("Layer '" + layerId + "' has invalid created_at '" + value + "'", e);
        }
    }

    private static double require(Double value, String field) {
        if (value == null) {
            throw new CalibrationException("Calibration document is missing " + field);
        }
        return value;
    }
}
