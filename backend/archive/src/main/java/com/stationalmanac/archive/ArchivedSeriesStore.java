package com.stationalmanac.archive;

import com.stationalmanac.core.model.Station;
import com.stationalmanac.core.model.TemperatureRecord;

import java.util.List;

public interface ArchivedSeriesStore {
    List<TemperatureRecord> load(Station station);
}
