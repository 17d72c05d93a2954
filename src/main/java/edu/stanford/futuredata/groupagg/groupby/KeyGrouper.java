package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.frame.Grouping;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups the rows of one chunk according to grouping parameters.
 */
public class KeyGrouper {

    /**
     * Group rows of data.  Key series are given in the order their keys appear in the parameters
     * and align with the data by row position.
     */
    public static GroupedFrame group(Frame data, GroupByParams params, List<Frame> keySeries) {
        if (params.getLevel() != null) {
            for (int level: params.getLevel()) {
                if (level < 0 || level >= data.indexLevels()) {
                    throw new IllegalArgumentException(
                            String.format("Level %d out of range for an index of %d levels", level, data.indexLevels()));
                }
            }
            Grouping grouping = Grouping.byIndexLevels(data, params.getLevel(), params.isSort());
            return new GroupedFrame(data, grouping, List.of(), params.getSelection(), params.isSeriesSelection());
        }
        List<String> names = new ArrayList<>();
        List<List<Object>> columns = new ArrayList<>();
        List<String> keyColumns = new ArrayList<>();
        List<DataType> keyTypes = new ArrayList<>();
        int series = 0;
        for (ByKey key: params.getBy()) {
            if (key.getKind() == ByKey.Kind.COLUMN) {
                int pos = data.ndim() == 2 ? data.positionOf(ColumnLabel.of(key.getColumn())) : -1;
                if (pos < 0) {
                    throw new IllegalArgumentException("Grouping key not found: " + key.getColumn());
                }
                columns.add(data.column(pos));
                keyTypes.add(data.getDtypes().get(pos));
                keyColumns.add(key.getColumn());
                names.add(key.getColumn());
            } else {
                Frame s = keySeries.get(series++);
                if (s.numRows() != data.numRows()) {
                    throw new IllegalArgumentException(String.format(
                            "Grouping key of length %d does not match data of length %d", s.numRows(), data.numRows()));
                }
                columns.add(s.column(0));
                keyTypes.add(s.getDtypes().get(0));
                Object name = s.getColumns().get(0).first();
                names.add(name == null ? null : name.toString());
            }
        }
        List<List<Object>> rowKeys = new ArrayList<>(data.numRows());
        for (int r = 0; r < data.numRows(); r++) {
            List<Object> key = new ArrayList<>(columns.size());
            for (List<Object> c: columns) {
                key.add(c.get(r));
            }
            rowKeys.add(key);
        }
        Grouping grouping = Grouping.of(rowKeys, names, keyTypes, params.isSort());
        return new GroupedFrame(data, grouping, keyColumns, params.getSelection(), params.isSeriesSelection());
    }
}
