package cold.spray.client;

/* Контроллер питателя доступен только построчно, пакетного чтения у него нет */
public interface FeederClient extends HardwareClient {
}
