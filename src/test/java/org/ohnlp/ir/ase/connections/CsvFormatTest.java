package org.ohnlp.ir.ase.connections;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvFormatTest {

    @Test
    void parsesQuotedFieldsAndLineBreaks() {
        List<List<String>> records = CsvFormat.parse(
                "id,name,note\r\n1,\"Smith, J\",\"said \"\"hi\"\"\"\n2,Doe,\"two\nlines\"\n\n3,,\n", ',');

        assertThat(records).hasSize(4);
        assertThat(records.get(1)).containsExactly("1", "Smith, J", "said \"hi\"");
        assertThat(records.get(2)).containsExactly("2", "Doe", "two\nlines");
        assertThat(records.get(3)).containsExactly("3", "", "");
    }

    @Test
    void readsRecordsOneAtATime() throws IOException {
        try (CsvFormat.RecordReader reader = new CsvFormat.RecordReader(
                new StringReader("\uFEFFa,b\r\n\r\n1,\"x\r\ny\"\n2,"), ',')) {
            assertThat(reader.next()).containsExactly("a", "b");
            assertThat(reader.next()).containsExactly("1", "x\r\ny");
            assertThat(reader.next()).containsExactly("2", "");
            assertThat(reader.next()).isNull();
            assertThat(reader.next()).isNull();
        }
    }

    @Test
    void stripsByteOrderMark() {
        assertThat(CsvFormat.parseLine("\uFEFFhospitalization_id|collect_dttm", '|'))
                .containsExactly("hospitalization_id", "collect_dttm");
    }

    @Test
    void rejectsUnterminatedQuote() {
        assertThatThrownBy(() -> CsvFormat.parse("a,\"b\n", ','))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsWithQuotingOnlyWhereNeeded() {
        assertThat(CsvFormat.formatLine(Arrays.asList("H1", null, "a,b", "say \"x\""), ","))
                .isEqualTo("H1,,\"a,b\",\"say \"\"x\"\"\"");
    }
}
