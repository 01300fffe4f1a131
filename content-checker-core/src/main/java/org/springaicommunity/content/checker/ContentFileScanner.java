package org.springaicommunity.content.checker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the content files of a directory that the platform can check.
 *
 * <p>
 * Files are listed in sorted path order so that batch outcomes and the representative
 * link are stable between runs.
 */
public class ContentFileScanner {

	private static final Logger logger = LoggerFactory.getLogger(ContentFileScanner.class);

	/**
	 * File extensions accepted by the platform, lower case and without the dot.
	 */
	public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
			// XML based
			"xml", "xhtm", "xhtml", "svg", "resx", "xlf", "xliff", "dita", "ditamap", "ditaval",
			// HTML
			"html", "htm",
			// Markdown
			"markdown", "mdown", "mkdn", "mkd", "md",
			// Plain text
			"txt",
			// Source code
			"java", "c", "h", "cc", "cpp", "cxx", "c++", "hh", "hpp", "hxx", "h++", "dic",
			// Configuration
			"yaml", "yml", "properties", "json");

	/**
	 * List the supported files of a directory.
	 * @param directory directory to scan
	 * @param recursive whether to descend into sub-directories
	 * @return supported regular files in sorted order, empty if the directory does not
	 * exist
	 * @throws ContentCheckException if the directory cannot be listed
	 */
	public List<Path> scan(Path directory, boolean recursive) {
		if (!Files.isDirectory(directory)) {
			logger.warn("Directory does not exist: {}", directory);
			return List.of();
		}

		int maxDepth = recursive ? Integer.MAX_VALUE : 1;
		try (Stream<Path> paths = Files.walk(directory, maxDepth)) {
			List<Path> all = paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
			List<Path> supported = all.stream().filter(this::isFileSupported).collect(Collectors.toList());
			logger.debug("Found {} supported files out of {} in {}", supported.size(), all.size(), directory);
			return supported;
		}
		catch (IOException e) {
			throw new ContentCheckException(ErrorKind.FILE_NOT_READABLE,
					"Failed to list content directory: " + e.getMessage(), directory.toString(), e);
		}
	}

	/**
	 * Whether the path is an existing, regular and readable file.
	 * @param filePath path to test
	 * @return true if the file can be read
	 */
	public boolean isFileValid(Path filePath) {
		if (!Files.exists(filePath)) {
			logger.warn("File does not exist: {}", filePath);
			return false;
		}
		if (!Files.isRegularFile(filePath)) {
			logger.warn("Path is not a regular file: {}", filePath);
			return false;
		}
		if (!Files.isReadable(filePath)) {
			logger.warn("Access denied to file: {}", filePath);
			return false;
		}
		return true;
	}

	/**
	 * Whether the file extension is one the platform accepts (case-insensitive).
	 * @param filePath path to test
	 * @return true if supported
	 */
	public boolean isFileSupported(Path filePath) {
		String extension = extensionOf(filePath);
		boolean supported = SUPPORTED_EXTENSIONS.contains(extension);
		if (!supported) {
			logger.debug("File extension '{}' is not supported: {}", extension, filePath);
		}
		return supported;
	}

	static String extensionOf(Path filePath) {
		Path fileName = filePath.getFileName();
		if (fileName == null) {
			return "";
		}
		String name = fileName.toString();
		int dot = name.lastIndexOf('.');
		return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}

}
