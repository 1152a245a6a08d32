package it.polimi.ds.ruleir.src;

import it.polimi.ds.ruleir.utils.SuppressFBWarnings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@SuppressFBWarnings(
        value = "PATH_TRAVERSAL_IN",
        justification = "All path are manually checked for traversal issues")
public class WorkDirFileLoader {

    private final Path baseDir;

    /**
     * @param baseDir base path from which start the file's path resolve
     */
    public WorkDirFileLoader(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    /**
     * @param fileName name of the rules file we want
     * @return its content, decoded as UTF-8 without a leading byte order mark
     */
    public String loadSource(String fileName) throws IOException {
        return stripBom(Files.readString(ensureNoFileTraversal(fileName), StandardCharsets.UTF_8));
    }

    /**
     * @param file name of the file we want
     * @return true if the file exists, otherwise false
     */
    @SuppressWarnings("BooleanMethodIsAlwaysInverted")
    public boolean resourceExists(String file) {
        return Files.isRegularFile(ensureNoFileTraversal(file));
    }

    /**
     * @param path path of the file we want
     * @return the resolved path, relative to the working directory
     */
    public Path resolvePath(String path) {
        return ensureNoFileTraversal(path);
    }

    public static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    /**
     * @param fileName path of the file we want
     * @return the path resolved if is in the workspace
     */
    private Path ensureNoFileTraversal(String fileName) {
        Path path = baseDir.resolve(fileName).normalize();
        if (!path.startsWith(baseDir))
            throw new IllegalStateException("Attempted file traversal " + path.toAbsolutePath());
        return path;
    }
}
