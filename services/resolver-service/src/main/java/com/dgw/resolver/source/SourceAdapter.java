package com.dgw.resolver.source;

import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.RawRelease;
import java.util.List;

public interface SourceAdapter {
    List<RawRelease> search(MediaTarget target);
}
