package hydroqc.analysis;

/**
 * Receptor de avance de una ejecución. Los avisos son orientativos: un receptor
 * lento o que falle no debe alterar el resultado del análisis.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Receptor que descarta todos los avisos.
     */
    ProgressListener NONE = (percent, step) -> {
    };

    /**
     * @param percent Porcentaje completado, en [0, 100].
     * @param step    Etiqueta legible de la etapa en curso.
     */
    void onProgress(int percent, String step);
}
