package org.kal.compiler.frontend.irgen;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.api.SourceInfo;

/**
 * Unwinds the lowering of the current function on the first semantic error.
 * Caught by {@link IrGenerator}, which turns it into a diagnostic.
 */
final class LoweringException extends RuntimeException {

	private final CompilerErrorCode code;
	private final SourceInfo source;

	LoweringException(CompilerErrorCode code, String message, SourceInfo source) {
		super(message, null, false, false);
		this.code = code;
		this.source = source;
	}

	CompilerErrorCode code() {
		return code;
	}

	SourceInfo source() {
		return source;
	}
}
