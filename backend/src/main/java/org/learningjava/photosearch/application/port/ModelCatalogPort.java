package org.learningjava.photosearch.application.port;

import java.util.List;

public interface ModelCatalogPort {
    List<String> listModels();
}
