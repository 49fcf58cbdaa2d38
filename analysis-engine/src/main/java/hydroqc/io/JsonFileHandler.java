package hydroqc.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persistencia de las colecciones GeoJSON generadas por {@link GeoJsonMapper}.
 * <p>
 * GeoJSON solo admite números finitos: un {@code NaN} o un infinito (por ejemplo,
 * la desviación de una región sin profundidades válidas) se escribe como {@code null}.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper GEOJSON_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .addModule(new SimpleModule("finite-numbers").addSerializer(Double.class, new FiniteDoubleSerializer()))
            .build();

    /**
     * Guarda una colección en disco, sustituyendo el fichero si ya existe.
     *
     * @param data Colección (normalmente un mapa de {@link GeoJsonMapper}).
     * @param path Fichero de destino; los directorios padre se crean.
     * @throws IOException Si falla la escritura.
     */
    public void writeToFile(Object data, Path path) throws IOException {
        log.info("Guardando GeoJSON en {}", path.toAbsolutePath());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            GEOJSON_MAPPER.writeValue(path.toFile(), data);
            log.debug("GeoJSON guardado ({} bytes).", Files.size(path));
        } catch (IOException e) {
            log.error("No se pudo guardar el GeoJSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Relee un fichero producido por {@link #writeToFile(Object, Path)}.
     *
     * @throws FileNotFoundException Si el fichero no existe.
     * @throws IOException Si el contenido no es JSON válido.
     */
    public JsonNode readTree(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("GeoJSON file not found: " + path.toAbsolutePath());
        }
        try {
            return GEOJSON_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            log.error("GeoJSON ilegible en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private static final class FiniteDoubleSerializer extends StdSerializer<Double> {

        FiniteDoubleSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (Double.isFinite(value)) {
                gen.writeNumber(value);
            } else {
                gen.writeNull();
            }
        }
    }
}
