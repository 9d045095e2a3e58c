package org.javai.askdata.validation;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DenylistTest {

	private final Denylist denylist = Denylist.defaults();

	@ParameterizedTest
	@ValueSource(strings = {"dropout_rate", "created_at", "updated_by", "deleted", "my_insert", "$drop", "replacement",
			"callback", "beginning", "grants2"})
	@DisplayName("does not match inside identifiers")
	void identifierBoundaries(String identifier) {
		assertThat(denylist.firstMatch("SELECT " + identifier + " FROM t")).isEmpty();
	}

	@Test
	@DisplayName("reports the earliest match with its category")
	void earliestMatch() {
		Denylist.Match match = denylist.firstMatch("x TRUNCATE y DROP").orElseThrow();

		assertThat(match.keyword()).isEqualTo("truncate");
		assertThat(match.category()).isEqualTo(DenyCategory.DATA_MODIFYING);
		assertThat(match.position()).isEqualTo(2);
	}

	@Test
	@DisplayName("matches across punctuation")
	void punctuation() {
		assertThat(denylist.firstMatch("a;drop(b)")).map(Denylist.Match::keyword).contains("drop");
	}

	@Test
	@DisplayName("covers every category")
	void categories() {
		assertThat(denylist.firstMatch("GRANT")).map(Denylist.Match::category).contains(DenyCategory.PRIVILEGE_ALTERING);
		assertThat(denylist.firstMatch("commit")).map(Denylist.Match::category).contains(DenyCategory.TRANSACTION_CONTROL);
		assertThat(denylist.firstMatch("ATTACH")).map(Denylist.Match::category).contains(DenyCategory.FILE_SYSTEM_ACCESS);
		assertThat(denylist.firstMatch("pragma")).map(Denylist.Match::category).contains(DenyCategory.ADMINISTRATIVE);
		assertThat(denylist.firstMatch("ALTER")).map(Denylist.Match::category).contains(DenyCategory.SCHEMA_ALTERING);
	}

	@Test
	@DisplayName("a prefix keyword matches every identifier that starts with it")
	void prefixKeywords() {
		Denylist.Match match = denylist.firstMatch("SELECT name FROM Pragma_Index_List('customers')").orElseThrow();

		assertThat(match.keyword()).isEqualTo("pragma_index_list");
		assertThat(match.category()).isEqualTo(DenyCategory.ADMINISTRATIVE);
		assertThat(match.position()).isEqualTo(17);
		assertThat(denylist.firstMatch("SELECT my_pragma_x FROM t")).isEmpty();
	}

	@Test
	@DisplayName("extras extend but never replace the defaults")
	void extras() {
		Denylist extended = Denylist.withExtras(List.of("Sleep", " ", "drop"));

		assertThat(extended.contains("sleep")).isTrue();
		assertThat(extended.keywords()).containsAll(Denylist.defaults().keywords());
		assertThat(extended.firstMatch("drop")).map(Denylist.Match::category).contains(DenyCategory.SCHEMA_ALTERING);
	}
}
