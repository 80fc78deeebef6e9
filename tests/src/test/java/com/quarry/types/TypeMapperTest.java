package com.quarry.types;

import com.quarry.model.ColumnSchema;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TypeMapper")
public class TypeMapperTest extends TestBase {

    @ParameterizedTest
    @ValueSource(strings = {"INTEGER", "int64", "BIGINT", "DOUBLE PRECISION", "DECIMAL(10,2)", "hugeint"})
    @DisplayName("TC-TYPE-001: numeric SQL types map to number")
    void testNumericTypes(String sqlType) {
        assertThat(TypeMapper.fromSqlType(sqlType)).isEqualTo(NumberType.get());
    }

    @ParameterizedTest
    @ValueSource(strings = {"VARCHAR", "text", "STRING", "CHARACTER VARYING(20)", "UUID"})
    @DisplayName("TC-TYPE-002: character SQL types map to string")
    void testStringTypes(String sqlType) {
        assertThat(TypeMapper.fromSqlType(sqlType)).isEqualTo(StringType.get());
    }

    @Test
    @DisplayName("TC-TYPE-003: temporal and boolean types")
    void testTemporalAndBooleanTypes() {
        assertThat(TypeMapper.fromSqlType("DATE")).isEqualTo(DateType.get());
        assertThat(TypeMapper.fromSqlType("TIMESTAMP WITH TIME ZONE")).isEqualTo(TimestampType.get());
        assertThat(TypeMapper.fromSqlType("datetime")).isEqualTo(TimestampType.get());
        assertThat(TypeMapper.fromSqlType("BOOL")).isEqualTo(BooleanType.get());
    }

    @Test
    @DisplayName("TC-TYPE-004: unknown types are kept as unsupported")
    void testUnsupportedType() {
        DataType type = TypeMapper.fromSqlType(" GEOGRAPHY ");

        assertThat(type).isInstanceOf(UnsupportedType.class);
        assertThat(((UnsupportedType) type).sqlType()).isEqualTo("GEOGRAPHY");
        assertThat(type.typeName()).isEqualTo("unsupported");
    }

    @Test
    @DisplayName("TC-TYPE-005: repeated scalar columns are unsupported")
    void testRepeatedScalarColumn() {
        assertThat(ColumnSchema.of("tags", "VARCHAR[]").dataType()).isInstanceOf(UnsupportedType.class);
        assertThat(ColumnSchema.repeatedRecord("items", List.of(ColumnSchema.of("sku", "VARCHAR")))
            .isRepeatedRecord()).isTrue();
    }

    @Test
    @DisplayName("TC-TYPE-006: empty SQL types are rejected")
    void testEmptySqlType() {
        assertThatThrownBy(() -> TypeMapper.fromSqlType(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("TC-TYPE-007: cast type names")
    void testFromTypeName() {
        assertThat(TypeMapper.fromTypeName("number")).isEqualTo(NumberType.get());
        assertThat(TypeMapper.fromTypeName(" String ")).isEqualTo(StringType.get());
        assertThat(TypeMapper.fromTypeName("timestamp")).isEqualTo(TimestampType.get());
        assertThat(TypeMapper.fromTypeName("json")).isNull();
        assertThat(TypeMapper.fromTypeName(null)).isNull();
    }
}
