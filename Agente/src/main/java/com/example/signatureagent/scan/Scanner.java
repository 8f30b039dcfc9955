package com.example.signatureagent.scan;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Módulo de enumeração de arquivos usado pelo agente de assinaturas.
 *
 * Responsabilidades principais:
 * - Caminhar uma árvore de diretórios a partir de um root (recursivo ou só o primeiro nível);
 * - Emitir um {@link FileEntry} por arquivo em modo streaming via {@link ScanConsumer};
 * - Ignorar arquivos ocultos/de sistema, a menos que o caller peça o contrário;
 * - Ser resiliente a erros pontuais (permissão negada, atributos ilegíveis),
 *   sem derrubar a execução inteira.
 *
 * Não calcula hash: isso é trabalho do DigestEngine, em paralelo, fora da travessia.
 */
public final class Scanner {

    private Scanner() {}

    /**
     * Snapshot dos atributos de um arquivo no momento da enumeração.
     * Imutável para poder atravessar threads sem cópia.
     */
    public static final class FileEntry {
        private final Path fullPath;
        private final String name;
        private final long sizeBytes;
        private final Instant createdUtc;
        private final Instant modifiedUtc;
        private final boolean directory;
        private final boolean readable;

        public FileEntry(Path fullPath, String name, long sizeBytes, Instant createdUtc,
                         Instant modifiedUtc, boolean directory, boolean readable) {
            this.fullPath = Objects.requireNonNull(fullPath, "fullPath");
            this.name = Objects.requireNonNull(name, "name");
            this.sizeBytes = sizeBytes;
            this.createdUtc = Objects.requireNonNull(createdUtc, "createdUtc");
            this.modifiedUtc = Objects.requireNonNull(modifiedUtc, "modifiedUtc");
            this.directory = directory;
            this.readable = readable;
        }

        /**
         * Lê os atributos do arquivo agora. Usado quando o caller passa um arquivo
         * avulso em vez de um diretório.
         */
        public static FileEntry of(Path path) throws IOException {
            Path absolute = path.toAbsolutePath().normalize();
            BasicFileAttributes attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
            return of(absolute, attrs);
        }

        static FileEntry of(Path absolute, BasicFileAttributes attrs) {
            Path fileName = absolute.getFileName();
            return new FileEntry(
                    absolute,
                    fileName != null ? fileName.toString() : absolute.toString(),
                    attrs.size(),
                    attrs.creationTime().toInstant(),
                    attrs.lastModifiedTime().toInstant(),
                    attrs.isDirectory(),
                    Files.isReadable(absolute));
        }

        public Path fullPath() { return fullPath; }
        public String name() { return name; }
        public long sizeBytes() { return sizeBytes; }
        public Instant createdUtc() { return createdUtc; }
        public Instant modifiedUtc() { return modifiedUtc; }
        public boolean isDirectory() { return directory; }
        public boolean isReadable() { return readable; }

        /** Existe, é arquivo regular legível e tem conteúdo. */
        public boolean isHashable() {
            return !directory && readable && sizeBytes > 0 && Files.exists(fullPath);
        }

        @Override
        public String toString() {
            return "FileEntry{" + fullPath + ", " + sizeBytes + " bytes}";
        }
    }

    /**
     * Contrato de callback chamado pelo {@link ScanService} em modo streaming.
     */
    public interface ScanConsumer {

        /**
         * Chamado para cada arquivo regular encontrado.
         */
        void onFileFound(FileEntry entry);

        /**
         * Chamado quando ocorre um erro não-fatal (ex.: permissão negada).
         * A varredura continua no próximo arquivo após este callback.
         */
        void onError(Path path, String message, IOException exc);
    }

    /**
     * Estatísticas agregadas de uma varredura.
     */
    public static final class ScanStatistics {
        private final long filesFound;
        private final long filesSkippedHidden;
        private final long directoriesVisited;
        private final long errors;

        public ScanStatistics(long filesFound, long filesSkippedHidden, long directoriesVisited, long errors) {
            this.filesFound = filesFound;
            this.filesSkippedHidden = filesSkippedHidden;
            this.directoriesVisited = directoriesVisited;
            this.errors = errors;
        }

        public long filesFound() { return filesFound; }
        public long filesSkippedHidden() { return filesSkippedHidden; }
        public long directoriesVisited() { return directoriesVisited; }
        public long errors() { return errors; }
    }

    /**
     * Serviço de varredura em modo streaming.
     *
     * Características:
     * - Usa {@link Files#walkFileTree}; profundidade 1 quando {@code recurse=false};
     * - Não segue links simbólicos (evita loops e "vazamento" para outros volumes);
     * - Ocultos (e, em volumes DOS/NTFS, arquivos de sistema) são pulados quando
     *   {@code includeHiddenAndSystem=false}, inclusive subárvores inteiras;
     * - Erros pontuais vão para {@link ScanConsumer#onError} e não abortam a varredura.
     *
     * Pensado para ser usado "um ScanService por execução"; não é thread-safe.
     */
    public static final class ScanService {

        private final boolean recurse;
        private final boolean includeHiddenAndSystem;

        /**
         * Flag interna para evitar spam quando o FS sempre falha em {@link Files#isHidden(Path)}.
         */
        private boolean hiddenAttrWarningLogged = false;

        public ScanService(boolean recurse, boolean includeHiddenAndSystem) {
            this.recurse = recurse;
            this.includeHiddenAndSystem = includeHiddenAndSystem;
        }

        public boolean recurse() {
            return recurse;
        }

        public boolean includeHiddenAndSystem() {
            return includeHiddenAndSystem;
        }

        /**
         * Versão conveniente que acumula tudo em memória, na ordem da travessia.
         */
        public List<FileEntry> list(Path root, ScanConsumer errorsOnly) throws IOException {
            List<FileEntry> files = new ArrayList<>();
            scan(root, new ScanConsumer() {
                @Override
                public void onFileFound(FileEntry entry) {
                    files.add(entry);
                }

                @Override
                public void onError(Path path, String message, IOException exc) {
                    if (errorsOnly != null) {
                        errorsOnly.onError(path, message, exc);
                    }
                }
            });
            return files;
        }

        /**
         * Executa a varredura a partir de {@code root}.
         *
         * @throws IOException apenas em erros fatais de estrutura
         *                     (root inválido, ciclo de symlink, falha geral do walkFileTree)
         */
        public ScanStatistics scan(Path root, ScanConsumer consumer) throws IOException {
            Objects.requireNonNull(root, "root");
            Objects.requireNonNull(consumer, "consumer");

            Path canonical = root.toAbsolutePath().normalize();
            if (!Files.isDirectory(canonical)) {
                throw new IOException("Caminho não é um diretório válido: " + canonical);
            }

            final long[] filesFound = new long[1];
            final long[] filesSkippedHidden = new long[1];
            final long[] dirsVisited = new long[1];
            final long[] errors = new long[1];

            int maxDepth = recurse ? Integer.MAX_VALUE : 1;

            try {
                Files.walkFileTree(canonical, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        dirsVisited[0]++;
                        // O root em si nunca é filtrado: quem passou o root sabe o que quer.
                        if (!dir.equals(canonical) && !includeHiddenAndSystem && isHiddenOrSystem(dir, consumer)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        // Com maxDepth=1 os subdiretórios chegam aqui como "arquivos"
                        if (!attrs.isRegularFile()) {
                            return FileVisitResult.CONTINUE;
                        }
                        if (!includeHiddenAndSystem && isHiddenOrSystem(file, consumer)) {
                            filesSkippedHidden[0]++;
                            return FileVisitResult.CONTINUE;
                        }
                        consumer.onFileFound(FileEntry.of(file, attrs));
                        filesFound[0]++;
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        errors[0]++;
                        consumer.onError(file, "Falha ao acessar caminho", exc);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                        if (exc != null) {
                            errors[0]++;
                            consumer.onError(dir, "Erro ao finalizar diretório", exc);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (FileSystemLoopException loop) {
                throw new IOException("Loop de sistema de arquivos detectado (symlink): " + loop.getFile(), loop);
            }

            return new ScanStatistics(filesFound[0], filesSkippedHidden[0], dirsVisited[0], errors[0]);
        }

        /**
         * Oculto via {@link Files#isHidden(Path)} ou, quando o FS expõe atributos DOS,
         * marcado como "system".
         *
         * Em caso de falha apenas a primeira exceção vai para o consumidor e o
         * caminho é tratado como visível, para não pular arquivos silenciosamente.
         */
        private boolean isHiddenOrSystem(Path path, ScanConsumer consumer) {
            try {
                if (Files.isHidden(path)) {
                    return true;
                }
                DosFileAttributes dos = readDosAttributes(path);
                return dos != null && (dos.isHidden() || dos.isSystem());
            } catch (IOException e) {
                if (!hiddenAttrWarningLogged) {
                    consumer.onError(path,
                            "Aviso: falha ao verificar atributo 'hidden'; "
                                    + "supressão de avisos futuros deste tipo nesta varredura.",
                            e);
                    hiddenAttrWarningLogged = true;
                }
                return false;
            }
        }

        private static DosFileAttributes readDosAttributes(Path path) throws IOException {
            try {
                return Files.readAttributes(path, DosFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (UnsupportedOperationException e) {
                // FS sem visão DOS (ext4, APFS...): só vale o isHidden
                return null;
            }
        }
    }
}
