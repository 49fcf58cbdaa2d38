package hydroqc.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Árbol de configuración de procesamiento, leído desde YAML.
 * <p>
 * Las claves se consultan mediante rutas separadas por puntos
 * (ej: {@code "anomaly_detection.isolation_forest.n_estimators"}) y cada llamada
 * aporta su propio valor por defecto, que se usa cuando la ruta no existe.
 * <p>
 * La instancia es inmutable: {@link #with(String, Object)} devuelve una copia
 * con el valor sustituido. El motor de análisis nunca modifica la configuración
 * que recibe.
 *
 * @author HydroQC
 * @since 0.1.0
 */
@Slf4j
public final class ProcessingConfig {

    /**
     * Recurso del classpath con los valores por defecto.
     */
    public static final String DEFAULTS_RESOURCE = "hydroqc-defaults.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper CANONICAL_MAPPER = createCanonicalMapper();
    private static final ObjectNode DEFAULT_TREE = readDefaultTree();

    private final ObjectNode root;

    private ProcessingConfig(ObjectNode root) {
        this.root = root;
    }

    private static ObjectMapper createCanonicalMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // Claves ordenadas para que la huella no dependa del orden del fichero.
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return mapper;
    }

    private static ObjectNode readDefaultTree() {
        try (InputStream in = ProcessingConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("No se encuentra el recurso de configuración por defecto: " + DEFAULTS_RESOURCE);
            }
            JsonNode tree = YAML_MAPPER.readTree(in);
            return asObject(tree, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("No se pudo leer la configuración por defecto " + DEFAULTS_RESOURCE, e);
        }
    }

    // --- Factorías ---

    /**
     * Configuración con los valores del recurso {@value #DEFAULTS_RESOURCE}.
     */
    public static ProcessingConfig defaults() {
        return new ProcessingConfig(DEFAULT_TREE.deepCopy());
    }

    /**
     * Configuración vacía: todas las consultas devuelven el valor por defecto de la llamada.
     */
    public static ProcessingConfig empty() {
        return new ProcessingConfig(JsonNodeFactory.instance.objectNode());
    }

    /**
     * Carga un fichero YAML y lo fusiona sobre los valores por defecto.
     *
     * @param path Ruta del fichero YAML.
     * @return La configuración resultante.
     * @throws FileNotFoundException Si el fichero no existe.
     * @throws IOException Si el fichero no es YAML válido.
     */
    public static ProcessingConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("El fichero de configuración no existe: " + path.toAbsolutePath());
        }
        log.info("Cargando configuración de procesamiento desde {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode tree = YAML_MAPPER.readTree(in);
            return defaults().mergedWith(tree, path.toString());
        }
    }

    /**
     * Interpreta un texto YAML y lo fusiona sobre los valores por defecto.
     */
    public static ProcessingConfig fromYaml(String yaml) {
        try {
            JsonNode tree = YAML_MAPPER.readTree(yaml);
            return defaults().mergedWith(tree, "<yaml>");
        } catch (IOException e) {
            throw new InvalidConfigurationException("El texto de configuración no es YAML válido.", e);
        }
    }

    private ProcessingConfig mergedWith(JsonNode overrides, String source) {
        ObjectNode merged = root.deepCopy();
        if (overrides != null && !overrides.isNull() && !overrides.isMissingNode()) {
            merge(merged, asObject(overrides, source));
        }
        return new ProcessingConfig(merged);
    }

    private static ObjectNode asObject(JsonNode node, String source) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            throw new InvalidConfigurationException("La raíz de la configuración debe ser un mapa: " + source);
        }
        return (ObjectNode) node;
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    // --- Consultas ---

    /**
     * Busca el nodo en la ruta indicada.
     *
     * @param path Ruta separada por puntos.
     * @return El nodo, o vacío si algún segmento no existe o el valor es nulo.
     */
    public Optional<JsonNode> find(String path) {
        JsonNode current = root;
        for (String key : splitPath(path)) {
            if (current == null || !current.isObject()) {
                return Optional.empty();
            }
            current = current.get(key);
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    public boolean contains(String path) {
        return find(path).isPresent();
    }

    public double getDouble(String path, double defaultValue) {
        Optional<JsonNode> node = find(path);
        if (node.isEmpty()) {
            return defaultValue;
        }
        JsonNode value = node.get();
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Valor numérico inválido en '" + path + "': " + value.textValue(), e);
            }
        }
        throw new InvalidConfigurationException("Se esperaba un número en '" + path + "' pero se encontró: " + value);
    }

    public int getInt(String path, int defaultValue) {
        double value = getDouble(path, defaultValue);
        if (value != Math.rint(value)) {
            throw new InvalidConfigurationException("Se esperaba un entero en '" + path + "' pero se encontró: " + value);
        }
        return (int) value;
    }

    public long getLong(String path, long defaultValue) {
        Optional<JsonNode> node = find(path);
        if (node.isPresent() && node.get().canConvertToLong()) {
            return node.get().longValue();
        }
        return (long) getDouble(path, defaultValue);
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Optional<JsonNode> node = find(path);
        if (node.isEmpty()) {
            return defaultValue;
        }
        JsonNode value = node.get();
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new InvalidConfigurationException("Se esperaba un booleano en '" + path + "' pero se encontró: " + value);
    }

    /**
     * Devuelve el valor como texto. Los números se devuelven en su forma textual
     * (útil para claves que admiten ambos, como {@code max_samples}).
     */
    public String getString(String path, String defaultValue) {
        return find(path)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .orElse(defaultValue);
    }

    /**
     * Lee un mapa plano {@code clave -> número}. Las entradas no numéricas se rechazan.
     *
     * @return Mapa ordenado según el fichero, o el mapa por defecto si la ruta no existe.
     */
    public Map<String, Double> getDoubleMap(String path, Map<String, Double> defaultValue) {
        Optional<JsonNode> node = find(path);
        if (node.isEmpty()) {
            return defaultValue;
        }
        if (!node.get().isObject()) {
            throw new InvalidConfigurationException("Se esperaba un mapa en '" + path + "'");
        }
        Map<String, Double> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new InvalidConfigurationException("Valor no numérico en '" + path + "." + field.getKey() + "'");
            }
            result.put(field.getKey(), field.getValue().doubleValue());
        }
        return Collections.unmodifiableMap(result);
    }

    // --- Derivación ---

    /**
     * Devuelve una copia con el valor indicado en la ruta. Los mapas intermedios
     * que falten se crean.
     *
     * @param path  Ruta separada por puntos.
     * @param value Valor a escribir (cualquier tipo serializable por Jackson).
     * @return Nueva configuración; la actual no cambia.
     */
    public ProcessingConfig with(String path, Object value) {
        String[] keys = splitPath(path);
        ObjectNode copy = root.deepCopy();
        ObjectNode current = copy;
        for (int i = 0; i < keys.length - 1; i++) {
            JsonNode child = current.get(keys[i]);
            if (child == null || !child.isObject()) {
                child = current.putObject(keys[i]);
            }
            current = (ObjectNode) child;
        }
        current.set(keys[keys.length - 1], YAML_MAPPER.valueToTree(value));
        return new ProcessingConfig(copy);
    }

    /**
     * Vista de solo lectura del árbol completo como mapas anidados.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = YAML_MAPPER.convertValue(root, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        return Collections.unmodifiableMap(map);
    }

    /**
     * Huella SHA-256 (hexadecimal) de la configuración en forma canónica.
     * Dos configuraciones con los mismos valores producen la misma huella,
     * independientemente del orden de las claves.
     */
    public String fingerprint() {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(asMap());
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (IOException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("No se pudo calcular la huella de la configuración.", e);
        }
    }

    private static String[] splitPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("La ruta de configuración no puede estar vacía.");
        }
        return path.split("\\.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return root.equals(((ProcessingConfig) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "ProcessingConfig" + root;
    }
}
