package com.example.signatureagent.progress;

import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converte bytes processados em um percentual de conclusão por root de busca.
 *
 * Cada arquivo contribui com seu tamanho em MB dividido em fases de custo:
 * - fase de digest: 24% por algoritmo para os 4 algoritmos (96% no total);
 *   com menos algoritmos os 96% são divididos igualmente entre os pedidos;
 * - fase de metadados (versão/certificado): 4%.
 *
 * Depois de cada fase emite {@code min(100, acumulado / total * 100)}.
 * O valor emitido nunca diminui e nunca passa de 100. Com total zero
 * (diretório vazio) emite 100 direto, sem dividir por zero.
 *
 * Thread-safe: os workers de hash chamam de threads diferentes, o lock é
 * a própria instância (dono único do acumulado).
 */
public final class ProgressEstimator {

    private static final Logger log = LoggerFactory.getLogger(ProgressEstimator.class);

    public static final double DIGEST_PHASE_WEIGHT = 0.96;
    public static final double METADATA_PHASE_WEIGHT = 0.04;

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Recebe o percentual a cada fase concluída.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(String root, String phase, double percentComplete);

        /** Listener que não faz nada. */
        static ProgressListener none() {
            return (root, phase, percent) -> { };
        }

        /**
         * Listener padrão: loga em INFO a cada {@code stepPercent} pontos percentuais.
         */
        static ProgressListener logging(double stepPercent) {
            return new ProgressListener() {
                private double nextMark = 0.0;

                @Override
                public synchronized void onProgress(String root, String phase, double percentComplete) {
                    if (percentComplete >= nextMark || percentComplete >= 100.0) {
                        log.info("[PROGRESSO] {}: {}%", root, String.format(Locale.ROOT, "%.1f", percentComplete));
                        nextMark = Math.floor(percentComplete / stepPercent) * stepPercent + stepPercent;
                    }
                }
            };
        }
    }

    private final String root;
    private final double totalMegabytes;
    private final double perAlgorithmWeight;
    private final ProgressListener listener;

    private double processedMegabytes = 0.0;
    private double lastEmitted = 0.0;

    /**
     * @param root            rótulo do root (só para o listener/log)
     * @param totalBytes      soma dos tamanhos de todos os arquivos sob o root, calculada antes de começar
     * @param algorithmCount  quantidade de algoritmos pedidos (1..4)
     */
    public ProgressEstimator(String root, long totalBytes, int algorithmCount, ProgressListener listener) {
        this.root = Objects.requireNonNull(root, "root");
        if (totalBytes < 0) {
            throw new IllegalArgumentException("totalBytes deve ser >= 0");
        }
        if (algorithmCount < 1) {
            throw new IllegalArgumentException("algorithmCount deve ser >= 1");
        }
        this.totalMegabytes = totalBytes / BYTES_PER_MB;
        this.perAlgorithmWeight = DIGEST_PHASE_WEIGHT / algorithmCount;
        this.listener = listener != null ? listener : ProgressListener.none();

        if (totalBytes == 0) {
            // Nada a processar: 100% imediato, sem divisão por zero
            this.lastEmitted = 100.0;
            this.listener.onProgress(root, "vazio", 100.0);
        }
    }

    public double totalMegabytes() {
        return totalMegabytes;
    }

    /**
     * Fase de digest de um algoritmo concluída para um arquivo.
     */
    public double recordDigestPhase(long fileSizeBytes, String algorithm) {
        return advance(fileSizeBytes / BYTES_PER_MB * perAlgorithmWeight, "digest:" + algorithm);
    }

    /**
     * Fase de metadados (versão/certificado) concluída para um arquivo.
     */
    public double recordMetadataPhase(long fileSizeBytes) {
        return advance(fileSizeBytes / BYTES_PER_MB * METADATA_PHASE_WEIGHT, "metadados");
    }

    /**
     * Fim do root: emite 100%. Cobre arquivos pulados ou que falharam e nunca
     * contribuíram com suas fases.
     */
    public synchronized double complete() {
        lastEmitted = 100.0;
        listener.onProgress(root, "concluido", lastEmitted);
        return lastEmitted;
    }

    public synchronized double percentComplete() {
        return lastEmitted;
    }

    private synchronized double advance(double weightedMegabytes, String phase) {
        if (weightedMegabytes > 0) {
            processedMegabytes += weightedMegabytes;
        }
        if (totalMegabytes > 0) {
            double percent = Math.min(100.0, processedMegabytes / totalMegabytes * 100.0);
            // Arredondamento de ponto flutuante nunca pode fazer o valor voltar
            lastEmitted = Math.max(lastEmitted, percent);
        }
        listener.onProgress(root, phase, lastEmitted);
        return lastEmitted;
    }
}
