package com.jreinhal.cafefinder.corpus;

import java.util.List;

/**
 * Pull-based source of one corpus category. Called at index build time only.
 */
@FunctionalInterface
public interface CorpusProvider<T> {

    List<T> listCurrent();
}
