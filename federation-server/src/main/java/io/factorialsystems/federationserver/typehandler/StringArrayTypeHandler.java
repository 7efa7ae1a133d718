package io.factorialsystems.federationserver.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * MyBatis type handler for PostgreSQL TEXT[] columns (tracking sets, image URLs, materials).
 * An empty list is written as an empty array so NOT NULL columns stay valid.
 */
@MappedTypes(List.class)
@MappedJdbcTypes(JdbcType.ARRAY)
public class StringArrayTypeHandler extends BaseTypeHandler<List<String>> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, List<String> parameter, JdbcType jdbcType) throws SQLException {
        Array array = ps.getConnection().createArrayOf("text", parameter.toArray(new String[0]));
        ps.setArray(i, array);
    }

    @Override
    public void setParameter(PreparedStatement ps, int i, List<String> parameter, JdbcType jdbcType) throws SQLException {
        if (parameter == null) {
            setNonNullParameter(ps, i, List.of(), jdbcType);
            return;
        }
        super.setParameter(ps, i, parameter, jdbcType);
    }

    @Override
    public List<String> getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return extractArray(rs.getArray(columnName));
    }

    @Override
    public List<String> getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return extractArray(rs.getArray(columnIndex));
    }

    @Override
    public List<String> getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return extractArray(cs.getArray(columnIndex));
    }

    private List<String> extractArray(Array array) throws SQLException {
        if (array == null) {
            return new ArrayList<>();
        }

        try {
            Object[] objectArray = (Object[]) array.getArray();
            if (objectArray == null) {
                return new ArrayList<>();
            }

            List<String> result = new ArrayList<>(objectArray.length);
            for (Object obj : objectArray) {
                if (obj != null) {
                    result.add(obj.toString());
                }
            }
            return result;
        } finally {
            array.free();
        }
    }
}
