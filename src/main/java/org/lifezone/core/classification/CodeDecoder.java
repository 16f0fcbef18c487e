package org.lifezone.core.classification;

import org.lifezone.core.exception.DecodeIndexOutOfRangeException;
import org.lifezone.core.model.AltitudinalBand;
import org.lifezone.core.model.Ecotone;
import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.LatitudinalBand;
import org.lifezone.core.model.LifeZoneCode;
import org.lifezone.core.model.ZoneTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Код классификации -> описание по Холдриджу (1967), например
 * "subtropical alpine rain forest - hyperhumid transitional life zone".
 */
public class CodeDecoder {

    public static final String NO_DATA_NAME = "No data";
    public static final String OUT_OF_BOUNDS_NAME = "No vegetation, outside of HLZ parameters";

    // names.get(i) - имя veg class i+1
    private final List<String> names;

    public CodeDecoder(List<String> names) {
        this.names = List.copyOf(names);
    }

    public static CodeDecoder forTable(ZoneTable table) {
        return new CodeDecoder(table.names());
    }

    public static LifeZoneCode fields(int code) {
        return LifeZoneCode.fromCode(code);
    }

    public String decode(int code) {
        if (code == HlzConstants.NO_DATA_CODE) return NO_DATA_NAME;
        if (code == HlzConstants.OUT_OF_BOUNDS_CODE) return OUT_OF_BOUNDS_NAME;
        if (code < 0) {
            throw new DecodeIndexOutOfRangeException(code, "negative code");
        }

        LifeZoneCode f = fields(code);
        if (f.vegClass() < 1 || f.vegClass() > names.size()) {
            throw new DecodeIndexOutOfRangeException(code, "veg class " + f.vegClass()
                    + " outside name table of " + names.size());
        }
        LatitudinalBand lat = LatitudinalBand.fromCode(f.latBand());
        if (lat == null) {
            throw new DecodeIndexOutOfRangeException(code, "latitudinal band " + f.latBand());
        }
        AltitudinalBand alt = AltitudinalBand.fromCode(f.altBand());
        if (alt == null) {
            throw new DecodeIndexOutOfRangeException(code, "altitudinal band " + f.altBand());
        }
        // 0..9 всегда раскладывается, но 8 и 9 не определены
        Ecotone eco = Ecotone.fromCode(f.ecotone());
        if (eco == null) {
            throw new DecodeIndexOutOfRangeException(code, "ecotone " + f.ecotone());
        }

        return lat.label + " " + alt.prefix() + names.get(f.vegClass() - 1) + eco.suffix;
    }

    /** Таблица код -> имя по различным кодам растра, по возрастанию кода. */
    public SortedMap<Integer, String> decodeAll(Collection<Integer> codes) {
        SortedMap<Integer, String> out = new TreeMap<>();
        for (Integer code : codes) {
            if (code == null || out.containsKey(code)) continue;
            out.put(code, decode(code));
        }
        return out;
    }

    public SortedMap<Integer, String> decodeAll(int[] codes) {
        List<Integer> boxed = new ArrayList<>(codes.length);
        for (int c : codes) boxed.add(c);
        return decodeAll(boxed);
    }
}
