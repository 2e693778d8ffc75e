package com.stationalmanac.archive;

import com.stationalmanac.core.model.Station;

import java.util.List;

public interface StationCatalog {
    List<Station> stations();
}
