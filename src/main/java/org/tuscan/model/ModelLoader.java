package org.tuscan.model;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.features.ScoringMode;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Loads a {@link RandomForestModel} from its JSON representation.
 * <p>
 * Document format:
 * <pre>
 * {
 *   "mode": "Regression",
 *   "featureCount": 63,
 *   "trees": [
 *     {"nodes": [
 *       {"feature": 0, "threshold": 40.0, "left": 1, "right": 2},
 *       {"value": 0.2},
 *       {"value": 0.7}
 *     ]}
 *   ]
 * }
 * </pre>
 * A node without {@code feature} is a leaf. The document's mode and feature count must match
 * the mode being scanned, otherwise the feature vectors would be misread.
 */
public final class ModelLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelLoader.class);

    private final Gson gson = new Gson();

    record ModelDocument(String mode, Integer featureCount, List<TreeDocument> trees) {}

    record TreeDocument(List<NodeDocument> nodes) {}

    record NodeDocument(Integer feature, Double threshold, Integer left, Integer right, Double value) {}

    /**
     * Loads a model file and checks it against the expected scoring mode.
     *
     * @param path     the JSON model file.
     * @param expected the mode that will be used to encode features.
     * @return the loaded model.
     * @throws ModelException if the file cannot be read, is malformed, or was trained for a
     *                        different mode or feature width.
     */
    public RandomForestModel load(Path path, ScoringMode expected) {
        if (!Files.isRegularFile(path)) {
            throw new ModelException("Model file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            RandomForestModel model = parse(reader, expected);
            log.info("Loaded {} model with {} trees from {}", model.mode().displayName(), model.treeCount(), path);
            return model;
        } catch (IOException e) {
            throw new ModelException("Failed to read model file " + path, e);
        }
    }

    /**
     * Parses a model document.
     *
     * @param reader   the JSON source.
     * @param expected the mode that will be used to encode features.
     * @return the parsed model.
     * @throws ModelException if the document is malformed or does not match {@code expected}.
     */
    public RandomForestModel parse(Reader reader, ScoringMode expected) {
        ModelDocument document;
        try {
            document = gson.fromJson(reader, ModelDocument.class);
        } catch (JsonParseException e) {
            throw new ModelException("Malformed model document: " + e.getMessage(), e);
        }
        if (document == null || document.mode() == null || document.featureCount() == null || document.trees() == null) {
            throw new ModelException("Model document must define 'mode', 'featureCount' and 'trees'");
        }

        ScoringMode mode;
        try {
            mode = ScoringMode.fromName(document.mode());
        } catch (IllegalArgumentException e) {
            throw new ModelException(e.getMessage(), e);
        }
        if (mode != expected) {
            throw new ModelException(String.format(
                "Model was trained for %s but %s scoring was requested", mode.displayName(), expected.displayName()));
        }
        int width = expected.layout().width();
        if (document.featureCount() != width) {
            throw new ModelException(String.format(
                "Model expects %d features but %s vectors have %d", document.featureCount(), mode.displayName(), width));
        }

        List<DecisionTree> trees = new ArrayList<>(document.trees().size());
        for (int t = 0; t < document.trees().size(); t++) {
            trees.add(toTree(t, document.trees().get(t)));
        }
        return new RandomForestModel(mode, width, trees);
    }

    private static DecisionTree toTree(int index, TreeDocument tree) {
        if (tree == null || tree.nodes() == null || tree.nodes().isEmpty()) {
            throw new ModelException("Tree " + index + " has no nodes");
        }
        List<NodeDocument> nodes = tree.nodes();
        int size = nodes.size();
        int[] feature = new int[size];
        double[] threshold = new double[size];
        int[] left = new int[size];
        int[] right = new int[size];
        double[] value = new double[size];

        for (int n = 0; n < size; n++) {
            NodeDocument node = nodes.get(n);
            if (node.feature() == null) {
                if (node.value() == null) {
                    throw new ModelException(String.format("Tree %d node %d is neither a split nor a leaf", index, n));
                }
                feature[n] = DecisionTree.LEAF;
                value[n] = node.value();
            } else {
                if (node.threshold() == null || node.left() == null || node.right() == null) {
                    throw new ModelException(String.format(
                        "Tree %d node %d must define 'threshold', 'left' and 'right'", index, n));
                }
                feature[n] = node.feature();
                threshold[n] = node.threshold();
                left[n] = node.left();
                right[n] = node.right();
            }
        }

        try {
            return new DecisionTree(feature, threshold, left, right, value);
        } catch (IllegalArgumentException e) {
            throw new ModelException("Tree " + index + ": " + e.getMessage(), e);
        }
    }
}
