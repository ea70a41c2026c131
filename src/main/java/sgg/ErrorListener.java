package sgg;

import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Collects lexer and parser errors instead of printing them, so a schema file
 * is reported with all of its errors at once.
 */
public class ErrorListener extends BaseErrorListener {
	private int errCount = 0;
	private final List<String> errors = Lists.newArrayList();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer,
			Object offendingSymbol, int line, int charPositionInLine,
			String msg, RecognitionException e) {
		errors.add("line " + line + ":" + charPositionInLine + " " + msg);
		errCount++;
	}

	public int getErrCount() {
		return errCount;
	}

	public ImmutableList<String> getErrors() {
		return ImmutableList.copyOf(errors);
	}

}
