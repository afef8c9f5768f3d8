package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import gnu.trove.list.array.TIntArrayList;

import java.util.List;

import org.junit.jupiter.api.Test;

class TokenParserTest {

	@Test
	void parsesCategoriesAndPlainTokens() throws Exception {
		List<Token> t = TokenParser.parse("tokens { cardinal { integer: \"one\" } } tokens { name: \",\" }");
		assertThat(t).hasSize(2);
		assertThat(t.get(0).getCategory()).isEqualTo("cardinal");
		assertThat(t.get(0).getField("integer")).isEqualTo("one");
		assertThat(t.get(1).isPlain()).isTrue();
		assertThat(t.get(1).getValue()).isEqualTo(",");
		assertThat(t.get(1).getVerbalizerName()).isEqualTo(TokenMarkers.PLAIN_FIELD);
	}

	@Test
	void keepsFieldOrder() throws Exception {
		Token t = TokenParser.parse("tokens { money { integer_part: \"five\" currency: \"dollars\" fractional_part: \"fifty\" } }").get(0);
		assertThat(t.getFields().keySet()).containsExactly("integer_part", "currency", "fractional_part");
	}

	@Test
	void unescapesQuotesAndBackslashes() throws Exception {
		Token t = TokenParser.parse("tokens { name: \"say \\\"hi\\\" \\\\o/\" }").get(0);
		assertThat(t.getValue()).isEqualTo("say \"hi\" \\o/");
	}

	@Test
	void toStringIsTheWireBody() throws Exception {
		Token t = new Token("time").addField("hours", "ten").addField("minutes", "thirty");
		assertThat(t.toString()).isEqualTo("time { hours: \"ten\" minutes: \"thirty\" }");
		assertThat(TokenParser.parse("tokens { "+t+" }")).containsExactly(t);
		Token p = Token.plain("a\"b");
		assertThat(p.toString()).isEqualTo("name: \"a\\\"b\"");
		assertThat(TokenParser.parse("tokens { "+p+" }").get(0).getValue()).isEqualTo("a\"b");
	}

	@Test
	void recordsWhereEachTokenOpensAndCloses() throws Exception {
		String s = "tokens { name: \"a\" } tokens { name: \"b\" }";
		TIntArrayList offsets = new TIntArrayList();
		TokenParser.parse(s, offsets);
		assertThat(offsets.toArray()).containsExactly(0, 19, 21, 40);
		assertThat(s.charAt(19)).isEqualTo('}');
		assertThat(s.charAt(40)).isEqualTo('}');
	}

	@Test
	void emptyStringHasNoTokens() throws Exception {
		assertThat(TokenParser.parse("")).isEmpty();
	}

	@Test
	void rejectsMalformedStrings() {
		String[] bad = {
				"tokens { name: \"open }",
				"tokens { cardinal { } }",
				"tokens { value: \"x\" }",
				"token { name: \"x\" }",
				"tokens { name: \"x\\q\" }",
				"tokens { cardinal { integer: \"one\" }",
		};
		for (String s : bad) {
			try {
				TokenParser.parse(s);
				fail("parsed "+s);
			}
			catch (DataFormatException e) {
				assertThat(e.getMessage()).startsWith("Bad token string");
			}
		}
	}
}
