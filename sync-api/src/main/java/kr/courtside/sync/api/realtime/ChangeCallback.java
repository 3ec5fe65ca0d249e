package kr.courtside.sync.api.realtime;

@FunctionalInterface
public interface ChangeCallback {

    void onChange(ChangeEvent event) throws Exception;
}
