package my.statementfusion.app.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class TextDecoding {
	private TextDecoding() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Decodes UTF-8 and falls back to latin-1 when the payload is not valid UTF-8.
	 */
	public static String decode(byte[] payload) {
		if (payload == null || payload.length == 0) {
			return "";
		}
		try {
			String utf8 = StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(payload))
					.toString();
			return stripBom(utf8);
		} catch (CharacterCodingException exc) {
			return stripBom(new String(payload, StandardCharsets.ISO_8859_1));
		}
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		String firstLine = sample.lines().findFirst().orElse("");
		if (firstLine.indexOf(';') >= 0) {
			return ';';
		}
		if (firstLine.indexOf('\t') >= 0) {
			return '\t';
		}
		return ',';
	}

	public static String normalizeSpaces(String value) {
		if (value == null) {
			return "";
		}
		return value.replace('\u00a0', ' ').replace('\u202f', ' ').replace('\u2007', ' ');
	}
}
