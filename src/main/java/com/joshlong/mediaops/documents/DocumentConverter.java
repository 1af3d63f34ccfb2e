package com.joshlong.mediaops.documents;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.utils.ProcessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * renders documents with LibreOffice and poppler. Everything goes through PDF: LibreOffice
 * turns office formats into PDF, and poppler turns PDF pages into images or text.
 */
class DocumentConverter {

	static final int DPI = 150;

	private static final Pattern PAGES = Pattern.compile("^Pages:\\s+(\\d+)\\s*$", Pattern.MULTILINE);

	/**
	 * one rendered page.
	 */
	record Page(int number, byte[] bytes) {
	}

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final MediaOpsProperties.Media.Tools tools;

	DocumentConverter(MediaOpsProperties.Media.Tools tools) {
		this.tools = tools;
	}

	/**
	 * writes {@code source} as {@code input.<format>} into the directory and returns the
	 * path of its PDF rendition.
	 */
	Path toPdf(Path directory, byte[] source, String format) throws IOException, InterruptedException {
		var input = FileUtils.write(directory, "input." + format, source);
		if (format.equals("pdf"))
			return input;
		ProcessUtils.runCommand(this.tools.soffice(), "--headless", "--invisible", "--nodefault", "--nolockcheck",
				"--nologo", "--norestore", "--convert-to", "pdf", "--outdir", directory.toAbsolutePath().toString(),
				input.toAbsolutePath().toString());
		var pdf = directory.resolve("input.pdf");
		if (!Files.exists(pdf))
			throw new IOException("LibreOffice did not produce a PDF from the " + format + " document");
		this.log.debug("converted a {} document into a PDF of {} bytes", format, Files.size(pdf));
		return pdf;
	}

	int pageCount(Path pdf) throws IOException, InterruptedException {
		var info = ProcessUtils.runCommand(this.tools.pdfinfo(), pdf.toAbsolutePath().toString()).stdoutAsString();
		return pageCount(info);
	}

	static int pageCount(String pdfinfo) {
		var matcher = PAGES.matcher(pdfinfo);
		if (!matcher.find())
			throw new IllegalStateException("pdfinfo did not report a page count");
		return Integer.parseInt(matcher.group(1));
	}

	/**
	 * renders each page, in order, as {@code png} or {@code jpg}.
	 */
	List<Page> toImages(Path pdf, List<Integer> pages, String format) throws IOException, InterruptedException {
		var rendered = new ArrayList<Page>(pages.size());
		var directory = pdf.getParent();
		for (var page : pages) {
			var prefix = directory.resolve("page-" + page);
			var number = String.valueOf(page);
			ProcessUtils.runCommand(this.tools.pdftoppm(), format.equals("png") ? "-png" : "-jpeg", "-r",
					String.valueOf(DPI), "-f", number, "-l", number, "-singlefile", pdf.toAbsolutePath().toString(),
					prefix.toAbsolutePath().toString());
			var image = directory.resolve("page-" + page + "." + format);
			rendered.add(new Page(page, Files.readAllBytes(image)));
		}
		return rendered;
	}

	/**
	 * extracts the text of each page, in order, separated by form feeds.
	 */
	String toText(Path pdf, List<Integer> pages) throws IOException, InterruptedException {
		var text = new StringBuilder();
		for (var page : pages) {
			var number = String.valueOf(page);
			var result = ProcessUtils.runCommand(this.tools.pdftotext(), "-layout", "-enc", "UTF-8", "-f", number,
					"-l", number, pdf.toAbsolutePath().toString(), "-");
			if (!text.isEmpty())
				text.append('\f');
			text.append(new String(result.stdout(), StandardCharsets.UTF_8));
		}
		return text.toString();
	}

}
