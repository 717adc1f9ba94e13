package io.mersel.services.patterns.application.interfaces;

/**
 * Çalışma zamanında yeniden yüklenebilen yapılandırma bileşenleri için arayüz.
 * <p>
 * Bu arayüzü uygulayan bileşenler (örn. düğüm yapılandırma kayıt defteri)
 * yapılandırma dosyası değiştiğinde yeniden yüklenir.
 */
public interface Reloadable {

    /**
     * Bileşenin yapılandırmasını kaynağından yeniden okur.
     * <p>
     * Uygulama, mevcut veriyi koruyarak yeni veriyi hazırlamalı
     * ve hazır olduğunda atomic swap ile değiştirmelidir.
     *
     * @return Yeniden yükleme sonucu
     */
    ReloadResult reload();

    /**
     * Bileşenin loglama ve raporlama için kullanılacak adı.
     */
    String getName();
}
