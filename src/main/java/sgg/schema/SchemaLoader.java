package sgg.schema;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import sgg.ErrorListener;
import sgg.schema.parser.SchemaAntlrParserLexer;
import sgg.schema.parser.SchemaAntlrParserParser;
import sgg.schema.parser.SchemaAntlrParserParser.SchemaFileContext;

/**
 * Reads {@code .syntax} schema files into a {@link SyntaxSchema}.
 */
public class SchemaLoader {

	private static final Logger log = Logger.getLogger(SchemaLoader.class.getName());

	public static SyntaxSchema load(File file) throws IOException {
		return parse(CharStreams.fromFileName(file.getPath()));
	}

	public static SyntaxSchema parse(String source, String sourceName) {
		return parse(CharStreams.fromString(source, sourceName));
	}

	private static SyntaxSchema parse(CharStream input) {
		ErrorListener errListener = new ErrorListener();

		SchemaAntlrParserLexer lexer = new SchemaAntlrParserLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);

		SchemaAntlrParserParser parser = new SchemaAntlrParserParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(errListener);

		SchemaFileContext f = parser.schemaFile();

		if (errListener.getErrCount() > 0) {
			throw new InvalidSchemaException(input.getSourceName(), errListener.getErrors());
		}
		SyntaxSchema schema = new SyntaxSchema(f.root, f.types);
		log.fine(() -> "Loaded " + f.types.size() + " types from " + input.getSourceName());
		return schema;
	}

}
